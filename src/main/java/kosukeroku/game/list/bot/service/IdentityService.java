package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.entity.PlayerIdentity;
import kosukeroku.game.list.bot.exception.NameTakenException;
import kosukeroku.game.list.bot.exception.UnboundIdentityException;
import kosukeroku.game.list.bot.repository.PlayerIdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {

    private final PlayerIdentityRepository identityRepository;

    public Optional<String> getSheetName(long userId) {
        return identityRepository.findById(userId)
                .map(PlayerIdentity::getSheetName);
    }

    public String requireSheetName(long userId) {
        return getSheetName(userId)
                .orElseThrow(() -> new UnboundIdentityException(userId));
    }

    // a repeated bind overwrites the previous name but keeps the known username
    public void bind(long userId, String sheetName) {
        Optional<Long> owner = findUserId(sheetName);
        if (owner.isPresent() && owner.get() != userId) {
            throw new NameTakenException(owner.get());
        }

        PlayerIdentity identity = identityRepository.findById(userId)
                .orElseGet(() -> new PlayerIdentity(userId, sheetName));
        identity.setSheetName(sheetName);
        identityRepository.save(identity);
        log.info("Bound user {} to sheet name {}", userId, sheetName);
    }

    // only bound users are tracked; a username moves to whoever used it last
    public void rememberUsername(long userId, String username) {
        if (username == null || username.isBlank()) {
            return;
        }
        String normalized = username.toLowerCase(Locale.ROOT);

        Optional<PlayerIdentity> identity = identityRepository.findById(userId);
        if (identity.isEmpty() || normalized.equals(identity.get().getTelegramUsername())) {
            return;
        }

        for (PlayerIdentity previous : identityRepository.findByTelegramUsername(normalized)) {
            if (!previous.getUserId().equals(userId)) {
                previous.setTelegramUsername(null);
                identityRepository.save(previous);
            }
        }

        identity.get().setTelegramUsername(normalized);
        identityRepository.save(identity.get());
        log.info("User {} goes by @{}", userId, normalized);
    }

    public Optional<Long> findUserIdByUsername(String username) {
        return identityRepository.findByTelegramUsername(username.toLowerCase(Locale.ROOT)).stream()
                .map(PlayerIdentity::getUserId)
                .findFirst();
    }

    public void forget(long userId) {
        identityRepository.deleteById(userId);
        log.info("Forgot identity of user {}", userId);
    }

    public Optional<Long> findUserId(String sheetName) {
        return identityRepository.findBySheetName(sheetName)
                .map(PlayerIdentity::getUserId);
    }
}
