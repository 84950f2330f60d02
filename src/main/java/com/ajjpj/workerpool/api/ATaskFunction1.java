package com.ajjpj.workerpool.api;


public interface ATaskFunction1<P1, T> {
    T apply (int workerIdx, P1 p1) throws Exception;
}
