package com.volforecast.engine.api;

public record ApiError(String timestamp, int status, String error, String message, String path) {
}
