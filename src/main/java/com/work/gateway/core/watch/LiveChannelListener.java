package com.work.gateway.core.watch;

/**
 * 传输层回调。可能在任意线程被调用，实现方负责切换到自己的执行上下文。
 */
public interface LiveChannelListener {

    void onMessage(String text);

    void onClose(int statusCode, String reason);

    void onError(Throwable error);
}
