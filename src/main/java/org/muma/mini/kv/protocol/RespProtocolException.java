package org.muma.mini.kv.protocol;

/**
 * 请求帧无法解析 (类型字节错误、长度非法、缺少 CRLF 等)
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(String message) {
        super(message);
    }
}
