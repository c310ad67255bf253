package com.cellmodeler.web;

public record SeedCell(int x, int y, String state) {
}
