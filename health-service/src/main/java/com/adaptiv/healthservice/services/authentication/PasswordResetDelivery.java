package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.models.Account;

/**
 * Hands a freshly issued reset token to the account holder.
 */
public interface PasswordResetDelivery {

    void deliver(Account account, String resetToken);
}
