package com.example.scrubservice.model;

import lombok.Data;

import jakarta.validation.constraints.NotBlank;

@Data
public class ScrubUrlRequest {
    @NotBlank(message = "URL cannot be blank")
    private String url;
}
