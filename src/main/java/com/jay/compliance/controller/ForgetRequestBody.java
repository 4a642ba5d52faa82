package com.jay.compliance.controller;

public record ForgetRequestBody(String companyId) {}
