package com.recbench.evaluation.controller;

public record ErrorResponse(String code, String message) {
}
