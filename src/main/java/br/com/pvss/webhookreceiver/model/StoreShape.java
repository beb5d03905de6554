package br.com.pvss.webhookreceiver.model;

public enum StoreShape {
    LATEST,
    HISTORY
}
