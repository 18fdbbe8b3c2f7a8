package com.example.musiccatalog.common.exception;

public class BusinessException extends RuntimeException {

    private final CatalogErrorCode errorCode;
    private final String userAction;

    public BusinessException(CatalogErrorCode errorCode, String message) {
        this(errorCode, message, errorCode.getUserAction());
    }

    public BusinessException(CatalogErrorCode errorCode, String message, String userAction) {
        super(message);
        this.errorCode = errorCode;
        this.userAction = userAction;
    }

    public CatalogErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }

    public String getUserAction() {
        return userAction;
    }
}
