package com.layercache.core;

/**
 * getAndUpdate 结果：回调保留的值与写入后的值（按 returnType 选择，pop 时为 null）
 */
public record UpdateResult(Object retained, Object updated) {
}
