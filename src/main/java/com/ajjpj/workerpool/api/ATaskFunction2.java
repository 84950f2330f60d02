package com.ajjpj.workerpool.api;


public interface ATaskFunction2<P1, P2, T> {
    T apply (int workerIdx, P1 p1, P2 p2) throws Exception;
}
