package kosukeroku.game.list.bot.repository;


import kosukeroku.game.list.bot.entity.PlayerIdentity;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerIdentityRepository extends CrudRepository<PlayerIdentity, Long> {
    Optional<PlayerIdentity> findBySheetName(String sheetName);

    List<PlayerIdentity> findByTelegramUsername(String telegramUsername);
}
