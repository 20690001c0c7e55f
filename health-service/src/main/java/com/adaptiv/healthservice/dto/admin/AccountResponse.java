package com.adaptiv.healthservice.dto.admin;

import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Account fields only. Never carries clinical data, so it is safe for admin listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {
    private UUID accountId;
    private String email;
    private String fullName;
    private Role role;
    private boolean active;
    private boolean verified;
    private LocalDateTime createdAt;
    private LocalDateTime lastLoginAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .accountId(account.getAccountId())
                .email(account.getEmail())
                .fullName(account.getFullName())
                .role(account.getRole())
                .active(account.isActive())
                .verified(account.isVerified())
                .createdAt(account.getCreatedAt())
                .lastLoginAt(account.getLastLoginAt())
                .build();
    }
}
