package org.showvault.service.show;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.showvault.exception.APIException;
import org.showvault.exception.ApiError;
import org.showvault.mapper.ShowSettingsMapper;
import org.showvault.model.QualitySelection;
import org.showvault.model.ShowSettingsUpdate;
import org.showvault.model.dto.ShowEditView;
import org.showvault.model.dto.ShowSettings;
import org.showvault.model.dto.request.CreateShowRequest;
import org.showvault.model.dto.request.ShowEditForm;
import org.showvault.model.dto.response.ShowUpdateResult;
import org.showvault.model.entity.ShowEntity;
import org.showvault.model.enums.PauseTransition;
import org.showvault.model.enums.QualityPreset;
import org.showvault.model.enums.ShowSettingField;
import org.showvault.model.event.ShowRemovedEvent;
import org.showvault.model.event.ShowSettingsChangedEvent;
import org.showvault.repository.ShowRepository;
import org.showvault.service.indexer.IndexerMetadataService;
import org.showvault.service.policy.GlobalConfigurationStore;
import org.showvault.service.policy.GlobalShowPolicy;
import org.showvault.util.ShowSettingsChangeDetector;
import org.showvault.util.WordListParser;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShowSettingsService {

    private final ShowRepository showRepository;
    private final ShowSettingsMapper showSettingsMapper;
    private final ShowEditFormParser showEditFormParser;
    private final LocationValidator locationValidator;
    private final ShowLockRegistry showLockRegistry;
    private final GlobalConfigurationStore globalConfigurationStore;
    private final IndexerMetadataService indexerMetadataService;
    private final QualityOptionsService qualityOptionsService;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public ShowSettings loadForShow(long showId) {
        return showSettingsMapper.toShowSettings(findShowOrThrow(showId), globalConfigurationStore.snapshot());
    }

    @Transactional(readOnly = true)
    public List<ShowSettings> getShows() {
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        return showRepository.findAllByOrderByNameAsc().stream()
                .map(show -> showSettingsMapper.toShowSettings(show, policy))
                .toList();
    }

    @Transactional(readOnly = true)
    public ShowEditView getEditView(long showId) {
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        ShowSettings settings = showSettingsMapper.toShowSettings(findShowOrThrow(showId), policy);
        List<String> languages = new ArrayList<>(indexerMetadataService.supportedLanguages());
        Collections.sort(languages);

        return ShowEditView.builder()
                .settings(settings)
                .seasonFoldersLocked(policy.seasonFoldersLocked())
                .subtitlesAvailable(policy.subtitlesEnabled())
                .releaseGroupListsVisible(settings.isAnime())
                .dateNamingConflict(settings.isAirByDate() && settings.isSports())
                .supportedLanguages(languages)
                .qualities(qualityOptionsService.optionsFor(settings.getQuality()))
                .selectedPreset(settings.getQualityPreset() != null ? settings.getQualityPreset() : "CUSTOM")
                .ignoreWordsText(WordListParser.join(settings.getIgnoreWords()))
                .requireWordsText(WordListParser.join(settings.getRequireWords()))
                .releaseGroupWhitelistText(WordListParser.join(settings.getReleaseGroupWhitelist()))
                .releaseGroupBlacklistText(WordListParser.join(settings.getReleaseGroupBlacklist()))
                .build();
    }

    /**
     * Validates the whole form, then writes it in one transaction. Nothing is stored when any
     * field is rejected.
     */
    public ShowUpdateResult applyUpdate(long showId, ShowEditForm form) {
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        return showLockRegistry.withLock(showId, () -> {
            if (!showRepository.existsById(showId)) {
                throw ApiError.SHOW_NOT_FOUND.createException(showId);
            }
            ShowSettingsUpdate update = showEditFormParser.parse(form, policy);
            String location = locationValidator.requireWritableDirectory(update.getLocation()).toString();
            return persist(showId, policy, show -> applyTo(show, update, location));
        });
    }

    public ShowSettings addSceneException(long showId, String name) {
        String exception = StringUtils.trimToNull(name);
        if (exception == null) {
            throw ApiError.VALIDATION_ERROR.createException("name", "scene exception must not be blank");
        }
        if (exception.length() > ShowEntity.SCENE_EXCEPTION_LENGTH) {
            throw ApiError.VALIDATION_ERROR.createException("name",
                    "scene exception must be at most " + ShowEntity.SCENE_EXCEPTION_LENGTH + " characters");
        }
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        return showLockRegistry.withLock(showId, () -> persist(showId, policy, show -> {
            if (show.getSceneExceptions().stream().noneMatch(exception::equalsIgnoreCase)) {
                show.getSceneExceptions().add(exception);
            }
        }).getSettings());
    }

    public ShowSettings removeSceneException(long showId, String name) {
        String exception = StringUtils.trimToEmpty(name);
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        return showLockRegistry.withLock(showId, () -> persist(showId, policy,
                show -> show.getSceneExceptions().removeIf(exception::equalsIgnoreCase)).getSettings());
    }

    public ShowSettings createShow(CreateShowRequest request) {
        GlobalShowPolicy policy = globalConfigurationStore.snapshot();
        long showId = request.getShowId();
        return showLockRegistry.withLock(showId, () -> {
            if (showRepository.existsById(showId)) {
                throw ApiError.SHOW_ALREADY_EXISTS.createException(showId);
            }
            String language = StringUtils.defaultIfBlank(request.getLanguage(), globalConfigurationStore.defaultLanguage()).trim();
            if (!indexerMetadataService.isSupportedLanguage(language)) {
                throw ApiError.UNSUPPORTED_LANGUAGE.createException(language);
            }
            QualitySelection quality = globalConfigurationStore.defaultQuality();
            if (StringUtils.isNotBlank(request.getQualityPreset())) {
                quality = QualityPreset.fromName(request.getQualityPreset())
                        .map(QualityPreset::getSelection)
                        .orElseThrow(() -> ApiError.VALIDATION_ERROR.createException("qualityPreset", "unknown preset '" + request.getQualityPreset() + "'"));
            }
            String location = locationValidator.requireWritableDirectory(request.getLocation()).toString();

            ShowEntity show = ShowEntity.builder()
                    .id(showId)
                    .name(request.getName().trim())
                    .location(location)
                    .quality(quality.toPacked())
                    .defaultEpisodeStatus(Optional.ofNullable(request.getDefaultEpisodeStatus()).orElseGet(globalConfigurationStore::defaultEpisodeStatus))
                    .language(language.toLowerCase(Locale.ROOT))
                    .subtitles(Optional.ofNullable(request.getSubtitles()).orElseGet(globalConfigurationStore::defaultSubtitles))
                    .anime(Optional.ofNullable(request.getAnime()).orElseGet(globalConfigurationStore::defaultAnime))
                    .sceneNumbering(globalConfigurationStore.defaultSceneNumbering())
                    .seasonFolders(policy.effectiveSeasonFolders(Optional.ofNullable(request.getSeasonFolders()).orElseGet(globalConfigurationStore::defaultSeasonFolders)))
                    .searchDelayDays(Optional.ofNullable(request.getSearchDelayDays()).orElseGet(globalConfigurationStore::defaultSearchDelayDays))
                    .updatedAt(Instant.now())
                    .build();

            ShowEntity saved = execute(showId, () -> showRepository.saveAndFlush(show));
            log.info("Added show '{}' ({}) at {}", saved.getName(), showId, location);
            return showSettingsMapper.toShowSettings(saved, policy);
        });
    }

    public void removeShow(long showId) {
        showLockRegistry.withLock(showId, () -> execute(showId, () -> {
            ShowEntity show = findShowOrThrow(showId);
            showRepository.delete(show);
            showRepository.flush();
            eventPublisher.publishEvent(new ShowRemovedEvent(showId));
            log.info("Removed show '{}' ({})", show.getName(), showId);
            return show;
        }));
    }

    private ShowUpdateResult persist(long showId, GlobalShowPolicy policy, Consumer<ShowEntity> mutation) {
        return execute(showId, () -> {
            ShowEntity show = findShowOrThrow(showId);
            Map<ShowSettingField, Object> before = ShowSettingsChangeDetector.snapshot(show);
            boolean wasPaused = show.isPaused();

            mutation.accept(show);

            Set<ShowSettingField> changed = ShowSettingsChangeDetector.changedFields(before, show);
            PauseTransition transition = PauseTransition.between(wasPaused, show.isPaused());
            if (!changed.isEmpty()) {
                show.setUpdatedAt(Instant.now());
                show = showRepository.saveAndFlush(show);
            }

            ShowSettings settings = showSettingsMapper.toShowSettings(show, policy);
            if (changed.isEmpty()) {
                log.debug("Update for show {} changed nothing", showId);
            } else {
                log.info("Updated show {} fields {}", showId, changed);
                if (transition != PauseTransition.NONE) {
                    log.info("Show {} is now {}", showId, settings.getState());
                }
                eventPublisher.publishEvent(ShowSettingsChangedEvent.builder()
                        .showId(showId)
                        .changedFields(Collections.unmodifiableSet(changed))
                        .pauseTransition(transition)
                        .settings(settings)
                        .build());
            }
            return ShowUpdateResult.builder()
                    .settings(settings)
                    .changedFields(changed)
                    .pauseTransition(transition)
                    .build();
        });
    }

    private <T> T execute(long showId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (APIException e) {
            throw e;
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Concurrent modification of show {}: {}", showId, e.getMessage());
            throw ApiError.SHOW_BUSY.createException(showId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to persist show {}", showId, e);
            throw ApiError.PERSISTENCE_FAILURE.wrap(e, showId, e.getMessage());
        }
    }

    private void applyTo(ShowEntity show, ShowSettingsUpdate update, String location) {
        show.setLocation(location);
        if (update.getQuality() != null) {
            show.setQuality(update.getQuality().toPacked());
        }
        if (update.getDefaultEpisodeStatus() != null) {
            show.setDefaultEpisodeStatus(update.getDefaultEpisodeStatus());
        }
        if (update.getLanguage() != null) {
            show.setLanguage(update.getLanguage());
        }
        show.setSkipDownloaded(update.isSkipDownloaded());
        show.setSubtitles(update.isSubtitles());
        show.setSubtitlesUseShowMetadata(update.isSubtitlesUseShowMetadata());
        show.setPaused(update.isPaused());
        show.setAirByDate(update.isAirByDate());
        show.setSports(update.isSports());
        show.setDvdOrder(update.isDvdOrder());
        show.setAnime(update.isAnime());
        show.setSceneNumbering(update.isSceneNumbering());
        show.setSeasonFolders(update.isSeasonFolders());
        if (update.getSearchDelayDays() != null) {
            show.setSearchDelayDays(update.getSearchDelayDays());
        }

        replaceIfChanged(update.getIgnoreWords(), show.getIgnoreWords(), show::setIgnoreWords);
        replaceIfChanged(update.getRequireWords(), show.getRequireWords(), show::setRequireWords);
        replaceIfChanged(update.getReleaseGroupWhitelist(), show.getReleaseGroupWhitelist(), show::setReleaseGroupWhitelist);
        replaceIfChanged(update.getReleaseGroupBlacklist(), show.getReleaseGroupBlacklist(), show::setReleaseGroupBlacklist);

        if (update.getSceneExceptions() != null && !update.getSceneExceptions().equals(show.getSceneExceptions())) {
            show.getSceneExceptions().clear();
            show.getSceneExceptions().addAll(update.getSceneExceptions());
        }
    }

    private void replaceIfChanged(List<String> submitted, List<String> stored, Consumer<List<String>> setter) {
        if (submitted != null && !submitted.equals(stored)) {
            setter.accept(new ArrayList<>(submitted));
        }
    }

    private ShowEntity findShowOrThrow(long showId) {
        return showRepository.findById(showId)
                .orElseThrow(() -> ApiError.SHOW_NOT_FOUND.createException(showId));
    }
}
