package br.com.pvss.webhookreceiver.exception;

public class RecordSerializationException extends RuntimeException {

    public RecordSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
