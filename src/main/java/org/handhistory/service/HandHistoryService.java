package org.handhistory.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.handhistory.dto.HandSummaryDTO;
import org.handhistory.dto.ParseBatchResult;
import org.handhistory.model.ParsedHand;
import org.handhistory.model.hand.HandHistory;
import org.handhistory.repo.ParsedHandRepository;
import org.handhistory.service.parsing.HandHistoryParser;
import org.handhistory.service.parsing.HandParseException;
import org.handhistory.service.parsing.RoomParserRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for parsing hands: picks the room adapter, runs the parser and keeps a JSON summary
 * of every parsed hand.
 */
@Slf4j
@Service
public class HandHistoryService {

    private final RoomParserRegistry rooms;
    private final ParsedHandRepository repo;
    private final ObjectMapper objectMapper;
    private final boolean persistResults;
    private final int maxTextLength;
    private final int recentLimit;

    public HandHistoryService(RoomParserRegistry rooms,
                              ParsedHandRepository repo,
                              ObjectMapper objectMapper,
                              @Value("${handhistory.persist-results:true}") boolean persistResults,
                              @Value("${handhistory.max-text-length:65536}") int maxTextLength,
                              @Value("${handhistory.recent-limit:15}") int recentLimit) {
        this.rooms = rooms;
        this.repo = repo;
        this.objectMapper = objectMapper;
        this.persistResults = persistResults;
        this.maxTextLength = maxTextLength;
        this.recentLimit = recentLimit;
    }

    /**
     * Full parse of one hand.
     * @throws HandParseException when the text does not follow the room's format
     * @throws IllegalArgumentException for an unknown room or an oversized text
     */
    @Transactional
    public HandHistory parse(String room, String text) {
        HandHistory hand = newParser(room, text).parse();
        log.debug("parsed {} hand #{}", hand.getRoom(), hand.getIdent());
        if (persistResults) record(hand);
        return hand;
    }

    /** Header only, for cheap scans; nothing is stored. */
    public HandHistory parseHeader(String room, String text) {
        return newParser(room, text).parseHeader();
    }

    @Transactional
    public HandHistory parseFile(String room, Path file) {
        HandHistoryParser parser;
        try {
            parser = HandHistoryParser.fromFile(rooms.get(room), file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + file, ex);
        }
        checkLength(parser.getHand().getRaw());
        HandHistory hand = parser.parse();
        if (persistResults) record(hand);
        return hand;
    }

    /**
     * Parses every text independently; a failing hand is reported and skipped.
     */
    @Transactional
    public ParseBatchResult parseAll(String room, List<String> texts) {
        rooms.get(room);
        ParseBatchResult result = new ParseBatchResult();
        for (int i = 0; i < texts.size(); i++) {
            try {
                result.getParsed().add(HandSummaries.from(parse(room, texts.get(i))));
            } catch (HandParseException ex) {
                log.warn("hand {} of batch skipped: {}", i, ex.getMessage());
                result.getFailures().add(new ParseBatchResult.Failure(
                        i, ex.getStage() == null ? null : ex.getStage().name(), ex.getFragmentIndex(), ex.getMessage()));
            } catch (IllegalArgumentException ex) {
                log.warn("hand {} of batch rejected: {}", i, ex.getMessage());
                result.getFailures().add(new ParseBatchResult.Failure(i, null, -1, ex.getMessage()));
            }
        }
        return result;
    }

    public Optional<HandSummaryDTO> findByIdent(String ident) {
        return repo.findFirstByIdent(ident).map(this::readSummary);
    }

    public List<HandSummaryDTO> recent(Integer limit) {
        int size = (limit == null || limit <= 0) ? recentLimit : limit;
        return repo.findAllByOrderByParsedAtDesc(PageRequest.of(0, size)).stream()
                .map(this::readSummary)
                .toList();
    }

    void record(HandHistory hand) {
        ParsedHand row = repo.findByRoomAndIdent(hand.getRoom(), hand.getIdent()).orElseGet(ParsedHand::new);
        row.setRoom(hand.getRoom());
        row.setIdent(hand.getIdent());
        row.setPlayedAt(hand.getDate() == null ? null : hand.getDate().toInstant());
        row.setSummaryJson(writeSummary(HandSummaries.from(hand)));
        repo.save(row);
    }

    private HandHistoryParser newParser(String room, String text) {
        checkLength(text);
        return new HandHistoryParser(rooms.get(room), text);
    }

    private void checkLength(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Empty hand history");
        if (text.length() > maxTextLength) {
            throw new IllegalArgumentException("Hand history too long: " + text.length() + " > " + maxTextLength);
        }
    }

    private String writeSummary(HandSummaryDTO summary) {
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize summary of hand #" + summary.getIdent(), ex);
        }
    }

    private HandSummaryDTO readSummary(ParsedHand row) {
        try {
            return objectMapper.readValue(row.getSummaryJson(), HandSummaryDTO.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt summary stored for hand #" + row.getIdent(), ex);
        }
    }
}
