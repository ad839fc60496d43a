package com.servicetracker.irita.tendermint;

/**
 * Thrown when a Tendermint RPC call fails (HTTP, JSON-RPC error, or unparseable body).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
