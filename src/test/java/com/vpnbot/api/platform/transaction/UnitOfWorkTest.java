package com.vpnbot.api.platform.transaction;

import com.vpnbot.api.users.entities.User;
import com.vpnbot.api.users.entities.UserRepository;
import lombok.val;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
public class UnitOfWorkTest {

    @Autowired
    private UnitOfWork unitOfWork;

    @Autowired
    private UserRepository userRepository;

    @AfterEach
    void tearDown() {
        userRepository.deleteAll();
    }

    @Test
    void execute() {
        final long id = unitOfWork.execute(() -> {
            assertTrue(TransactionSynchronizationManager.isActualTransactionActive());
            return userRepository.save(User.builder().id(1).build()).getId();
        });

        assertEquals(1, id);
        assertTrue(userRepository.existsById(1L));
    }

    @Test
    void execute_withCheckedException() {
        val thrown = assertThrows(IOException.class, () -> unitOfWork.run(() -> {
            userRepository.save(User.builder().id(1).build());
            throw new IOException("test");
        }));

        assertEquals("test", thrown.getMessage());
        assertFalse(userRepository.existsById(1L));
    }

    @Test
    void execute_withNestedWork() {
        assertThrows(IllegalStateException.class, () -> unitOfWork.run(() -> {
            unitOfWork.run(() -> userRepository.save(User.builder().id(1).build()));
            userRepository.save(User.builder().id(2).build());
            throw new IllegalStateException("test");
        }));

        // the inner work joined the outer transaction and rolled back with it.
        assertFalse(userRepository.existsById(1L));
        assertFalse(userRepository.existsById(2L));
    }
}
