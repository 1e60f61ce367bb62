package org.liveindex.filesystem.dto;

/**
 * Git 远程仓库。
 *
 * @param name     远程名称（如 origin）
 * @param fetchUrl fetch 地址
 * @param pushUrl  push 地址（未单独声明时与 fetchUrl 相同）
 */
public record GitRemote(String name, String fetchUrl, String pushUrl) {
}
