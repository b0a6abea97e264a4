package com.example.scrubservice.model;

import lombok.Data;

import jakarta.validation.constraints.NotBlank;

@Data
public class ScrubTextRequest {
    @NotBlank(message = "Content cannot be blank")
    private String content;
}
