package com.xjx.txdb.common;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 10:12
 * 全局的异常表，以对象身份进行比较
 */
public class Error {
    //common
    public static final RuntimeException FileExistsException = new RuntimeException("File already exists!");
    public static final RuntimeException FileNotExistsException = new RuntimeException("File does not exists!");
    public static final RuntimeException FileCannotRWException = new RuntimeException("File cannot read or write!");

    //dm
    public static final RuntimeException BadLogFileException = new RuntimeException("Bad log file!");
    public static final RuntimeException BadLogRecordException = new RuntimeException("Bad log record!");
    public static final RuntimeException BadStoreFileException = new RuntimeException("Bad store file!");
    public static final RuntimeException BadCheckpointFileException = new RuntimeException("Bad checkpoint file!");

    //lm
    public static final RuntimeException DeadlockException = new RuntimeException("Deadlock!");
    public static final RuntimeException LockWaitInterruptedException = new RuntimeException("Interrupted while waiting for lock!");

    //to
    public static final RuntimeException TimestampConflictException = new RuntimeException("Timestamp conflict!");
    public static final RuntimeException UnknownTimestampException = new RuntimeException("Transaction has no timestamp!");

    //tm
    public static final RuntimeException NoTransactionException = new RuntimeException("Transaction does not exist!");
    public static final RuntimeException TransactionClosedException = new RuntimeException("Transaction is closed!");

    //rm
    public static final RuntimeException RecoveryAlreadyDoneException = new RuntimeException("Recovery already done!");
    public static final RuntimeException RecoveryNotDoneException = new RuntimeException("Recovery not done yet!");

    //launcher
    public static final RuntimeException InvalidCommandException = new RuntimeException("Invalid command!");
}
