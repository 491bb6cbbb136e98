package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.entity.PlayerIdentity;
import kosukeroku.game.list.bot.exception.NameTakenException;
import kosukeroku.game.list.bot.exception.UnboundIdentityException;
import kosukeroku.game.list.bot.repository.PlayerIdentityRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityServiceTest {

    @Mock
    private PlayerIdentityRepository identityRepository;

    @InjectMocks
    private IdentityService identityService;

    @Test
    void bindsFreeName() {
        when(identityRepository.findBySheetName("Alice")).thenReturn(Optional.empty());

        identityService.bind(1L, "Alice");

        ArgumentCaptor<PlayerIdentity> saved = ArgumentCaptor.forClass(PlayerIdentity.class);
        verify(identityRepository).save(saved.capture());
        assertEquals(1L, saved.getValue().getUserId());
        assertEquals("Alice", saved.getValue().getSheetName());
    }

    @Test
    void rebindingOwnNameIsAllowed() {
        when(identityRepository.findBySheetName("Alice")).thenReturn(Optional.of(new PlayerIdentity(1L, "Alice")));

        identityService.bind(1L, "Alice");

        verify(identityRepository).save(any(PlayerIdentity.class));
    }

    @Test
    void nameBoundToSomeoneElseIsRefused() {
        when(identityRepository.findBySheetName("Alice")).thenReturn(Optional.of(new PlayerIdentity(7L, "Alice")));

        NameTakenException e = assertThrows(NameTakenException.class, () -> identityService.bind(1L, "Alice"));

        assertThat(e.getMessage()).contains("<@7>");
        verify(identityRepository, never()).save(any());
    }

    @Test
    void unboundUserIsADomainError() {
        when(identityRepository.findById(3L)).thenReturn(Optional.empty());

        UnboundIdentityException e = assertThrows(UnboundIdentityException.class,
                () -> identityService.requireSheetName(3L));
        assertThat(e.getMessage()).contains("<@3>");
    }

    @Test
    void forgetDeletesTheBinding() {
        identityService.forget(4L);

        verify(identityRepository).deleteById(4L);
    }

    @Test
    void findsUserIdBySheetName() {
        when(identityRepository.findBySheetName("Bob")).thenReturn(Optional.of(new PlayerIdentity(9L, "Bob")));

        assertEquals(Optional.of(9L), identityService.findUserId("Bob"));
    }

    @Test
    void rebindKeepsRememberedUsername() {
        PlayerIdentity existing = new PlayerIdentity(1L, "Alice");
        existing.setTelegramUsername("alice");
        when(identityRepository.findBySheetName("Alicia")).thenReturn(Optional.empty());
        when(identityRepository.findById(1L)).thenReturn(Optional.of(existing));

        identityService.bind(1L, "Alicia");

        ArgumentCaptor<PlayerIdentity> saved = ArgumentCaptor.forClass(PlayerIdentity.class);
        verify(identityRepository).save(saved.capture());
        assertEquals("Alicia", saved.getValue().getSheetName());
        assertEquals("alice", saved.getValue().getTelegramUsername());
    }

    @Test
    void remembersUsernameOfBoundUserInLowercase() {
        PlayerIdentity bob = new PlayerIdentity(2L, "Bob");
        when(identityRepository.findById(2L)).thenReturn(Optional.of(bob));
        when(identityRepository.findByTelegramUsername("bob")).thenReturn(List.of());

        identityService.rememberUsername(2L, "Bob");

        assertEquals("bob", bob.getTelegramUsername());
        verify(identityRepository).save(bob);
    }

    @Test
    void usernameMovesAwayFromPreviousHolder() {
        PlayerIdentity bob = new PlayerIdentity(2L, "Bob");
        PlayerIdentity stale = new PlayerIdentity(8L, "Old Bob");
        stale.setTelegramUsername("bob");
        when(identityRepository.findById(2L)).thenReturn(Optional.of(bob));
        when(identityRepository.findByTelegramUsername("bob")).thenReturn(List.of(stale));

        identityService.rememberUsername(2L, "bob");

        assertNull(stale.getTelegramUsername());
        verify(identityRepository).save(stale);
        verify(identityRepository).save(bob);
    }

    @Test
    void unboundOrNamelessUsersAreNotTracked() {
        when(identityRepository.findById(3L)).thenReturn(Optional.empty());

        identityService.rememberUsername(3L, "carol");
        identityService.rememberUsername(3L, null);

        verify(identityRepository, never()).save(any());
    }

    @Test
    void findsUserIdByUsernameIgnoringCase() {
        when(identityRepository.findByTelegramUsername("bob")).thenReturn(List.of(new PlayerIdentity(2L, "Bob")));

        assertEquals(Optional.of(2L), identityService.findUserIdByUsername("BoB"));
    }
}
