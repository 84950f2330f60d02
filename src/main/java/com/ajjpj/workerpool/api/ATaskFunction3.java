package com.ajjpj.workerpool.api;


public interface ATaskFunction3<P1, P2, P3, T> {
    T apply (int workerIdx, P1 p1, P2 p2, P3 p3) throws Exception;
}
