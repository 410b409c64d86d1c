package com.example.ledger.application.domain.account.exception;

import com.example.ledger.application.domain.account.aggregate.vo.ViolationType;

import lombok.Getter;

/**
 * 業務不變量違反
 *
 * <p>
 * 由狀態轉移函式拋出，代表該事件在目前狀態下不被允許。屬於可恢復錯誤：呼叫端的操作失敗，但聚合根狀態完全不變。
 * </p>
 */
@Getter
public class InvariantViolationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final ViolationType violationType;

	public InvariantViolationException(ViolationType violationType, String message) {
		super(message);
		this.violationType = violationType;
	}
}
