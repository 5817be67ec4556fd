package com.astralcore.mfa.domain.ports;

import com.astralcore.mfa.domain.mfa.UserAccount;

import java.util.Optional;

public interface UserDirectory {

    Optional<UserAccount> findById(String userId);
}
