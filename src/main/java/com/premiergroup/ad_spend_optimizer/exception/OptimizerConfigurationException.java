package com.premiergroup.ad_spend_optimizer.exception;

public class OptimizerConfigurationException extends OptimizerException {

    public OptimizerConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-CFG-001";
    }
}
