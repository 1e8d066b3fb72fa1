package com.edgechat.inference;

@FunctionalInterface
public interface CleanUpListener {
    void onCleanUp();
}
