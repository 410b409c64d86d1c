package com.example.ledger.application.domain.account.aggregate.vo;

/**
 * 業務不變量違反類型
 */
public enum ViolationType {
	ALREADY_ACTIVE, // 帳戶已開立，不可重複開戶
	INACTIVE_ACCOUNT, // 帳戶尚未開立
	INSUFFICIENT_FUNDS // 餘額不足
}
