package kosukeroku.game.list.bot.responseDTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// sheets omits trailing blank cells, so rows can be shorter than the heading row
@JsonIgnoreProperties(ignoreUnknown = true)
public record SheetValuesResponse(
        @JsonProperty("range") String range,
        @JsonProperty("majorDimension") String majorDimension,
        @JsonProperty("values") List<List<String>> values
) {}
