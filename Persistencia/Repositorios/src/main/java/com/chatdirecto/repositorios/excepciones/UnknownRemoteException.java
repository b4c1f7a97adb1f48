package com.chatdirecto.repositorios.excepciones;

public class UnknownRemoteException extends RemoteStoreException {

    public UnknownRemoteException(int code, String message) {
        super(code, message);
    }
}
