package com.vpnbot.api.users;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.ReferralServiceContract;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.users.entities.User;
import com.vpnbot.api.users.entities.UserRepository;
import com.vpnbot.api.users.exceptions.TrialAlreadyUsedException;
import com.vpnbot.api.users.exceptions.UserNotFoundException;
import com.vpnbot.api.users.payload.RegisterUserParams;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final long USER_ID = 42L;

    @Mock
    private UserConfiguration userConfig;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ReferralServiceContract referralServiceContract;

    @Mock
    private SubscriptionServiceContract subscriptionServiceContract;

    @Mock
    private VpnServiceContract vpnServiceContract;

    @Mock
    private NotificationServiceContract notificationServiceContract;

    private OffsetDateTime now;
    private UserService service;

    @BeforeEach
    void setUp() {
        val clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        now = OffsetDateTime.now(clock);
        lenient().when(userConfig.getTrialDays()).thenReturn(3);
        lenient().when(userRepository.save(any())).thenAnswer(i -> i.getArgument(0));

        service = new UserService(
            userConfig,
            userRepository,
            referralServiceContract,
            subscriptionServiceContract,
            vpnServiceContract,
            notificationServiceContract,
            new UnitOfWork(mock(PlatformTransactionManager.class)),
            clock);
    }

    @Test
    void register_withReferralCode() {
        when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

        val response = service.register(buildParams("abcd2345"));
        assertEquals(USER_ID, response.getId());
        assertEquals("alice", response.getUsername());
        assertFalse(response.getHasTrial());
        verify(referralServiceContract).registerReferral(USER_ID, "abcd2345");
    }

    @Test
    void register_withExistingUser() {
        val existing = User.builder()
            .id(USER_ID)
            .username("old")
            .hasTrial(true)
            .build();

        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(existing));

        val response = service.register(buildParams("abcd2345"));
        assertEquals("alice", response.getUsername());
        assertTrue(response.getHasTrial());
        verify(referralServiceContract, never()).registerReferral(anyLong(), anyString());
    }

    @Test
    void getUser_withUnknownUser() {
        when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());
        assertThrows(UserNotFoundException.class, () -> service.getUser(USER_ID));
    }

    @Test
    void activateTrial() throws Exception {
        val user = User.builder().id(USER_ID).build();
        when(userRepository.existsById(USER_ID)).thenReturn(true);
        when(userRepository.findWithLockById(USER_ID)).thenReturn(Optional.of(user));
        when(subscriptionServiceContract.grantDays(USER_ID, 3, now)).thenReturn(now.plusDays(3));
        when(vpnServiceContract.provision(USER_ID)).thenReturn(ProvisioningStatus.PROVISIONED);

        val response = service.activateTrial(USER_ID);
        assertEquals(now.plusDays(3), response.getAccessEndsAt());
        assertEquals(ProvisioningStatus.PROVISIONED, response.getProvisioning());
        assertTrue(user.isHasTrial());
        verify(notificationServiceContract).notify(
            eq(USER_ID), eq(NotificationKind.TRIAL_ACTIVATED), eq("trial:" + USER_ID), any());

        // the trial can be used only once.
        assertThrows(TrialAlreadyUsedException.class, () -> service.activateTrial(USER_ID));
        verify(subscriptionServiceContract).grantDays(anyLong(), anyInt(), any());
        verify(vpnServiceContract).provision(USER_ID);
    }

    @Test
    void activateTrial_withDeferredProvisioning() throws Exception {
        when(userRepository.existsById(USER_ID)).thenReturn(true);
        when(userRepository.findWithLockById(USER_ID)).thenReturn(Optional.of(User.builder().id(USER_ID).build()));
        when(subscriptionServiceContract.grantDays(USER_ID, 3, now)).thenReturn(now.plusDays(3));
        when(vpnServiceContract.provision(USER_ID)).thenReturn(ProvisioningStatus.DEFERRED);

        assertEquals(ProvisioningStatus.DEFERRED, service.activateTrial(USER_ID).getProvisioning());
        verify(notificationServiceContract).notify(
            eq(USER_ID), eq(NotificationKind.PROVISIONING_DELAYED), eq("trial:" + USER_ID), any());
    }

    @Test
    void activateTrial_withUnknownUser() {
        when(userRepository.existsById(USER_ID)).thenReturn(false);
        assertThrows(UserNotFoundException.class, () -> service.activateTrial(USER_ID));
        verify(vpnServiceContract, never()).provision(anyLong());
    }

    private static RegisterUserParams buildParams(String referralCode) {
        return RegisterUserParams.builder()
            .id(USER_ID)
            .username("alice")
            .firstName("Alice")
            .languageCode("en")
            .referralCode(referralCode)
            .build();
    }
}
