package com.aiinpocket.studyquest.gateway;

/**
 * 事件儲存存取在重試用盡後仍失敗。
 */
public class GatewayException extends RuntimeException {

    private final String operation;

    public GatewayException(String operation, Throwable cause) {
        super("事件儲存操作失敗: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
