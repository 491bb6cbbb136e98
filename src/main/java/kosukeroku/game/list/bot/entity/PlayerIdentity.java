package kosukeroku.game.list.bot.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.redis.core.RedisHash;
import org.springframework.data.redis.core.index.Indexed;

import java.io.Serializable;

@RedisHash("player_identities")
@NoArgsConstructor
@Data
public class PlayerIdentity implements Serializable {

    @Id
    private Long userId; // telegram user id

    @Indexed
    private String sheetName; // column heading under "who owns"

    @Indexed
    private String telegramUsername; // lowercase, without '@'

    private Long boundAt;

    public PlayerIdentity(Long userId, String sheetName) {
        this.userId = userId;
        this.sheetName = sheetName;
        this.boundAt = System.currentTimeMillis();
    }

}
