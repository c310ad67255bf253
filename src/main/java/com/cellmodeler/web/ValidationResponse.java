package com.cellmodeler.web;

import java.util.List;

public record ValidationResponse(boolean valid, List<String> errors) {
}
