package com.bbthechange.tvguide.controller;

import com.bbthechange.tvguide.dto.ChannelDTO;
import com.bbthechange.tvguide.dto.CreateChannelRequest;
import com.bbthechange.tvguide.dto.MessageResponse;
import com.bbthechange.tvguide.dto.UpdateChannelRequest;
import com.bbthechange.tvguide.model.CategoryCount;
import com.bbthechange.tvguide.model.ChannelFilter;
import com.bbthechange.tvguide.service.ChannelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the channel catalog.
 */
@RestController
@Tag(name = "Channels", description = "Channel catalog and categories")
public class ChannelController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ChannelController.class);

    private final ChannelService channelService;

    public ChannelController(ChannelService channelService) {
        this.channelService = channelService;
    }

    /**
     * GET /channels?category=&search=&active_only=
     */
    @GetMapping("/channels")
    @Operation(summary = "List channels",
               description = "Case-insensitive substring filters on category and name. Active channels only unless active_only=false. At most 1000 results.")
    public ResponseEntity<List<ChannelDTO>> getChannels(
            @Parameter(description = "Filter by category") @RequestParam(required = false) String category,
            @Parameter(description = "Search in channel names") @RequestParam(required = false) String search,
            @Parameter(description = "Show only active channels") @RequestParam(name = "active_only", defaultValue = "true") boolean activeOnly) {

        logger.debug("Listing channels category={}, search={}, activeOnly={}", category, search, activeOnly);
        return ResponseEntity.ok(channelService.getChannels(new ChannelFilter(category, search, activeOnly)));
    }

    @PostMapping("/channels")
    @Operation(summary = "Create a channel")
    public ResponseEntity<ChannelDTO> createChannel(@Valid @RequestBody CreateChannelRequest request) {
        logger.info("Creating channel '{}'", request.getName());
        return ResponseEntity.ok(channelService.createChannel(request));
    }

    @GetMapping("/channels/{channelId}")
    @Operation(summary = "Get a channel by id")
    public ResponseEntity<ChannelDTO> getChannel(@PathVariable String channelId) {
        return ResponseEntity.ok(channelService.getChannel(channelId));
    }

    @PutMapping("/channels/{channelId}")
    @Operation(summary = "Update a channel", description = "Only the fields present in the body are changed.")
    public ResponseEntity<ChannelDTO> updateChannel(
            @PathVariable String channelId,
            @RequestBody UpdateChannelRequest request) {

        logger.info("Updating channel {}", channelId);
        return ResponseEntity.ok(channelService.updateChannel(channelId, request));
    }

    @DeleteMapping("/channels/{channelId}")
    @Operation(summary = "Delete a channel permanently")
    public ResponseEntity<MessageResponse> deleteChannel(@PathVariable String channelId) {
        logger.info("Deleting channel {}", channelId);
        channelService.deleteChannel(channelId);
        return ResponseEntity.ok(MessageResponse.of("Channel deleted successfully"));
    }

    @GetMapping("/categories")
    @Operation(summary = "List categories with channel counts", description = "Counts include inactive channels.")
    public ResponseEntity<List<CategoryCount>> getCategories() {
        return ResponseEntity.ok(channelService.getCategories());
    }
}
