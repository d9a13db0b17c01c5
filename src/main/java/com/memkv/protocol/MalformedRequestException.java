package com.memkv.protocol;

// message is the response text sent back to the client
public class MalformedRequestException extends Exception {

    public MalformedRequestException(String message) {
        super(message);
    }
}
