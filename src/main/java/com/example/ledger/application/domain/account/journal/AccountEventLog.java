package com.example.ledger.application.domain.account.journal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.example.ledger.application.domain.account.event.AccountEvent;

/**
 * 帳戶事件日誌 (Append-only Journal)
 *
 * <p>
 * 純粹的儲存與排序元件：只負責依序追加，不做任何業務驗證 (驗證由聚合根在追加前透過狀態轉移函式完成)。
 * 事件一旦寫入，其位置與內容永不改變。
 * </p>
 */
public class AccountEventLog {

	private final List<AccountEvent> events;
	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	public AccountEventLog() {
		this.events = new ArrayList<>();
	}

	/**
	 * 以既有事件歷史建立日誌 (用於重建聚合根)
	 *
	 * @param history 依寫入順序排列的事件
	 */
	public AccountEventLog(List<? extends AccountEvent> history) {
		Objects.requireNonNull(history, "history");
		history.forEach(e -> Objects.requireNonNull(e, "history 不可包含 null 事件"));
		this.events = new ArrayList<>(history);
	}

	/**
	 * 將事件追加至日誌尾端
	 */
	public void append(AccountEvent event) {
		Objects.requireNonNull(event, "event");
		lock.writeLock().lock();
		try {
			events.add(event);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * 取得完整事件序列的唯讀快照
	 *
	 * @return 與日誌內部脫鉤的不可變清單，依寫入順序排列
	 */
	public List<AccountEvent> all() {
		lock.readLock().lock();
		try {
			return List.copyOf(events);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int size() {
		lock.readLock().lock();
		try {
			return events.size();
		} finally {
			lock.readLock().unlock();
		}
	}
}
