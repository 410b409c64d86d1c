package com.example.ledger.application.port;

import java.util.concurrent.CompletableFuture;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.command.AccountCommand;

/**
 * 命令發布 Port
 */
public interface CommandBusPort {

	/**
	 * 送出指令
	 *
	 * @param command 帳戶指令
	 * @return 指令執行後的帳戶狀態；失敗時以原始例外異常完成
	 */
	CompletableFuture<AccountState> dispatch(AccountCommand command);
}
