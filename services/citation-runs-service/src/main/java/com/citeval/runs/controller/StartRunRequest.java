package com.citeval.runs.controller;

import java.util.Map;

public record StartRunRequest(Map<String, Object> config) {
}
