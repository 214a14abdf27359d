package com.tenframework.runtime.path;

/**
 * 一个结果在路径表中的查找结果。
 *
 * @param path             结果所属的输出路径
 * @param completesCommand 该结果是否结清了命令（路径已从表中移除）
 */
public record ResultResolution(PathOut path, boolean completesCommand) {
}
