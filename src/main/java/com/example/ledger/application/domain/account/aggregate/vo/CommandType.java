package com.example.ledger.application.domain.account.aggregate.vo;

/**
 * 帳戶指令類型
 */
public enum CommandType {
	CREATE, // 開戶
	DEPOSIT, // 存款
	WITHDRAW, // 提款
	REPLAY, // 由事件日誌重建狀態
	RESTORE, // 以外部歷史取代登錄中的聚合根
	EVICT // 自倉儲移除帳戶
}
