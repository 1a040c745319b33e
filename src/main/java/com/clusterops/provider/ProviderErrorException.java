package com.clusterops.provider;

/**
 * The provider answered with an explicit error payload, or with something that could not be
 * decoded at all. The detail is kept verbatim so operators see what the provider said.
 */
public class ProviderErrorException extends ProviderException {
    private final String errorCode;
    private final String detail;

    public ProviderErrorException(String errorCode, String detail) {
        super(errorCode == null ? detail : errorCode + ": " + detail);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public ProviderErrorException(String errorCode, String detail, Throwable cause) {
        super(errorCode == null ? detail : errorCode + ": " + detail, cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public static ProviderErrorException malformed(String detail, Throwable cause) {
        return new ProviderErrorException(null, detail, cause);
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String getDetail() {
        return detail;
    }
}
