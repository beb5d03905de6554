package br.com.pvss.webhookreceiver.config;

public enum BackendType {
    REDIS,
    MEMORY
}
