package com.xjx.txdb.server.dm;

import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.utils.Panic;
import com.xjx.txdb.server.utils.Parser;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * @Author: Xjx
 * @Create: 2023/3/6 - 9:14
 * 记录最近一次完成的检查点的起始seq，恢复时从这里开始确定扫描位置
 */
public class CheckpointMarker {
    public static final String CKPT_SUFFIX = ".ckpt";
    //修改检查点文件时的临时文件后缀
    public static final String CKPT_TMP_SUFFIX = ".ckpt_tmp";
    //还没有完成过检查点
    public static final long NONE = 0;

    String path;
    File file;

    public static CheckpointMarker create(String path) {
        removeBadTmp(path);
        File f = new File(path + CKPT_SUFFIX);
        try {
            if(!f.createNewFile()) {
                Panic.panic(Error.FileExistsException);
            }
        } catch (Exception e) {
            Panic.panic(e);
        }
        if(!f.canRead() || !f.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
        CheckpointMarker marker = new CheckpointMarker(path, f);
        marker.update(NONE);
        return marker;
    }

    public static CheckpointMarker open(String path) {
        removeBadTmp(path);
        File f = new File(path + CKPT_SUFFIX);
        if(!f.exists()) {
            Panic.panic(Error.FileNotExistsException);
        }
        if(!f.canRead() || !f.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
        return new CheckpointMarker(path, f);
    }

    private static void removeBadTmp(String path) {
        new File(path + CKPT_TMP_SUFFIX).delete();
    }

    private CheckpointMarker(String path, File file) {
        this.path = path;
        this.file = file;
    }

    public long load() {
        byte[] buf = null;
        try {
            buf = Files.readAllBytes(file.toPath());
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        if(buf.length != 8) {
            Panic.panic(Error.BadCheckpointFileException);
        }
        return Parser.parseLong(buf);
    }

    public void update(long checkpointSeq) {
        File tmp = new File(path + CKPT_TMP_SUFFIX);
        try(FileOutputStream out = new FileOutputStream(tmp)) {
            out.write(Parser.long2Byte(checkpointSeq));
            out.flush();
            out.getFD().sync();
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        try {
            Files.move(tmp.toPath(), new File(path + CKPT_SUFFIX).toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Panic.panic(e);
        }
        file = new File(path + CKPT_SUFFIX);
        if(!file.canRead() || !file.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
    }
}
