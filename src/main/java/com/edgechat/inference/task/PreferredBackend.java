package com.edgechat.inference.task;

public enum PreferredBackend {
    CPU,
    GPU
}
