/*
 * どこで: Commerce API
 * 何を: 顧客の登録/更新リクエストを保持する
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerRequest(
    @NotBlank(message = "first_name is required")
        @Size(max = 50, message = "first_name must be at most 50 characters")
        String firstName,
    @NotBlank(message = "last_name is required")
        @Size(max = 50, message = "last_name must be at most 50 characters")
        String lastName,
    @NotBlank(message = "email is required")
        @Email(message = "email is invalid")
        @Size(max = 255, message = "email must be at most 255 characters")
        String email,
    @Size(max = 20, message = "phone must be at most 20 characters") String phone) {}
