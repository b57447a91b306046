package com.changelab.mentor.api;

public record ApiError(boolean success, String error) {
    public static ApiError of(String error) {
        return new ApiError(false, error);
    }
}
