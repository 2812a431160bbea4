package com.docgraph.core.store;

/** 그래프 저장/조회 실패(I/O, 직렬화). */
public class GraphStoreException extends Exception {
    public GraphStoreException(String message) { super(message); }
    public GraphStoreException(String message, Throwable cause) { super(message, cause); }
}
