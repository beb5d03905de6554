package br.com.pvss.webhookreceiver.service;

public enum PipelineMode {
    OPEN,
    CLOUD_EVENTS
}
