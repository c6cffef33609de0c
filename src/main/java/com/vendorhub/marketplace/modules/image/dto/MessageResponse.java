package com.vendorhub.marketplace.modules.image.dto;

public record MessageResponse(String message) {
}
