package com.roof.measurement.dto;

/**
 * Result of calling an external measurement provider: a body, an explicit "no data" answer, or an
 * error. Provider clients never throw; tiers turn the latter two into tier failures.
 */
public record ProviderResult<T>(Status status, T body, Integer httpStatus, String errorMessage, long latencyMs) {

    public enum Status {
        SUCCESS,
        NO_DATA,
        ERROR
    }

    public static <T> ProviderResult<T> success(T body, long latencyMs) {
        return new ProviderResult<>(Status.SUCCESS, body, 200, null, latencyMs);
    }

    public static <T> ProviderResult<T> noData(Integer httpStatus, String reason, long latencyMs) {
        return new ProviderResult<>(Status.NO_DATA, null, httpStatus, reason, latencyMs);
    }

    public static <T> ProviderResult<T> error(Integer httpStatus, String errorMessage, long latencyMs) {
        return new ProviderResult<>(Status.ERROR, null, httpStatus, errorMessage, latencyMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isNoData() {
        return status == Status.NO_DATA;
    }
}
