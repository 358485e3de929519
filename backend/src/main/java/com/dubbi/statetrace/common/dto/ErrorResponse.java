package com.dubbi.statetrace.common.dto;

public record ErrorResponse(String code, String message) {}
