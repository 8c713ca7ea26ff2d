package com.vpnbot.api.users;

import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.users.entities.UserRepository;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link UserRegistryService} exposes the user ledger to other packages. It depends on nothing but
 * the ledger, so any service may use it.
 */
@Service
class UserRegistryService implements UserServiceContract {

    private final UserRepository userRepository;

    @Autowired
    UserRegistryService(@NonNull UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public boolean isRegistered(long userId) {
        return userRepository.existsById(userId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lockUser(long userId) {
        return userRepository.findWithLockById(userId).isPresent();
    }
}
