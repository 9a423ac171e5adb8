package org.ifcserver.ifc.model;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 模型写事务（单写者）。
 * <p>
 * 事务内的所有实体注册与关系修改都会记录撤销动作；{@link #commit()} 后撤销日志被丢弃，
 * 未提交就 {@link #close()}（包括事务体抛异常）时按逆序执行撤销，模型回到事务开始前的状态。
 * <p>
 * 必须在开启事务的同一线程上提交/关闭。
 */
public final class IfcTransaction implements AutoCloseable {

    private final IfcModel model;
    private final String name;
    private final Thread owner;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private boolean finished;

    IfcTransaction(IfcModel model, String name) {
        this.model = model;
        this.name = name;
        this.owner = Thread.currentThread();
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return !finished;
    }

    boolean isOwnedByCurrentThread() {
        return owner == Thread.currentThread();
    }

    void onRollback(Runnable undo) {
        if (finished) {
            throw new InvalidModelStateException("事务已结束：" + name);
        }
        undoLog.push(undo);
    }

    public void commit() {
        if (finished) {
            throw new InvalidModelStateException("事务已结束，不能重复提交：" + name);
        }
        requireOwner("提交");
        undoLog.clear();
        finished = true;
        model.endTransaction(this, true);
    }

    public void rollback() {
        if (finished) {
            return;
        }
        requireOwner("回滚");
        // push 为头插，逐个 pop 即为逆序撤销
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        finished = true;
        model.endTransaction(this, false);
    }

    private void requireOwner(String action) {
        if (!isOwnedByCurrentThread()) {
            throw new InvalidModelStateException("只能在开启事务的线程上" + action + "：" + name
                    + "（开启线程：" + owner.getName() + "）");
        }
    }

    @Override
    public void close() {
        rollback();
    }
}
