package com.z254.lazarus.api.mapper;

import com.z254.lazarus.api.dto.PlaybookDto;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookDefinitionMapper;

import java.util.Locale;

/**
 * Mapper for playbook to DTO conversion.
 */
public final class PlaybookMapper {

    private PlaybookMapper() {}

    public static PlaybookDto toDto(Playbook playbook) {
        return PlaybookDto.builder()
                .id(playbook.getId())
                .name(playbook.getName())
                .version(playbook.getVersion())
                .description(playbook.getDescription())
                .triggerPattern(playbook.getTriggerPattern().toString())
                .priority(playbook.getPriority())
                .maxRetries(playbook.getMaxRetries())
                .requiresApproval(playbook.isRequiresApproval())
                .autonomyTier(playbook.getAutonomyTier().name().toLowerCase(Locale.ROOT))
                .publishedAt(playbook.getPublishedAt())
                .steps(PlaybookDefinitionMapper.toDefinition(playbook).getSteps())
                .build();
    }
}
