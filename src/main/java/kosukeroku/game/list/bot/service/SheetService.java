package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.exception.SheetApiException;
import kosukeroku.game.list.bot.modelDTO.GameCatalog;
import kosukeroku.game.list.bot.responseDTO.SheetValuesResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;

@Slf4j
@Service
public class SheetService {

    private static final String SPREADSHEET_URL = "https://docs.google.com/spreadsheets/d/";

    private final WebClient webClient;
    private final SheetParser sheetParser;
    private final String apiKey;
    private final String range;

    public SheetService(
            WebClient.Builder webClientBuilder,
            SheetParser sheetParser,
            @Value("${google.sheets.api-key:}") String apiKey,
            @Value("${game-list.sheet.range:A:ZZ}") String range) {
        this.webClient = webClientBuilder.baseUrl("https://sheets.googleapis.com").build();
        this.sheetParser = sheetParser;
        this.apiKey = apiKey;
        this.range = range;
    }

    // always goes to the network, catalogs are not cached between commands
    public GameCatalog fetch(String spreadsheetId) {
        log.info("Fetching game list {} range {}", spreadsheetId, range);

        SheetValuesResponse response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/v4/spreadsheets/{id}/values/{range}")
                            .queryParam("key", apiKey)
                            .build(spreadsheetId, range))
                    .retrieve()
                    .bodyToMono(SheetValuesResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("Sheets API answered {} for spreadsheet {}", e.getStatusCode(), spreadsheetId);
            throw new SheetApiException("could not read the spreadsheet (" + e.getStatusCode() + ")", e);
        } catch (Exception e) {
            log.warn("Could not reach Sheets API for spreadsheet {}: {}", spreadsheetId, e.getMessage());
            throw new SheetApiException("could not reach the spreadsheet", e);
        }

        if (response == null) {
            throw new SheetApiException("empty response");
        }
        // a blank sheet comes back without values and fails on the missing headings
        return sheetParser.parse(response.values() == null ? List.of() : response.values());
    }

    public String spreadsheetUrl(String spreadsheetId) {
        return SPREADSHEET_URL + spreadsheetId;
    }
}
