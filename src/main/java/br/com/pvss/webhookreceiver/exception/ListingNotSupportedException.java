package br.com.pvss.webhookreceiver.exception;

public class ListingNotSupportedException extends RuntimeException {

    public ListingNotSupportedException(String backend) {
        super("Listagem de chaves não suportada pelo backend " + backend);
    }
}
