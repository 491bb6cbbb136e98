package kosukeroku.game.list.bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameListBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameListBotApplication.class, args);
    }
}
