package com.example.cloudbeatsbackup.application.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cloudbeatsbackup.application.service.BackupGenerationService;
import com.example.cloudbeatsbackup.application.service.InteractiveSetupService;
import com.example.cloudbeatsbackup.application.service.TokenResolutionService;
import com.example.cloudbeatsbackup.common.config.AppCacheProperties;
import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.exception.BackupExitCodeMapper;
import com.example.cloudbeatsbackup.common.exception.DropboxAuthException;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.example.cloudbeatsbackup.domain.model.AuthorizationGrant;
import com.example.cloudbeatsbackup.domain.model.BackupRunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class BackupCommandRunnerTest {

    private AppRunProperties runProperties;
    private AppCacheProperties cacheProperties;
    private TokenResolutionService tokenResolutionService;
    private InteractiveSetupService interactiveSetupService;
    private BackupGenerationService backupGenerationService;
    private BackupCommandRunner runner;

    @BeforeEach
    void setUp() {
        runProperties = new AppRunProperties();
        cacheProperties = new AppCacheProperties();
        tokenResolutionService = mock(TokenResolutionService.class);
        interactiveSetupService = mock(InteractiveSetupService.class);
        backupGenerationService = mock(BackupGenerationService.class);
        when(backupGenerationService.generate(anyString(), any(AppRunProperties.class)))
                .thenReturn(new BackupRunReport());
        runner = new BackupCommandRunner(runProperties, cacheProperties, tokenResolutionService,
                interactiveSetupService, backupGenerationService, new BackupExitCodeMapper(), new RunCancellation());
    }

    @Test
    void switchesShouldEnableDryRunAndDisableCache() {
        runner.applySwitches(new DefaultApplicationArguments("--dry-run", "--no-cache", "--local=/x"));

        assertTrue(runProperties.isDryRun());
        assertFalse(cacheProperties.isEnabled());
    }

    @Test
    void explicitFalseSwitchShouldBeIgnored() {
        runner.applySwitches(new DefaultApplicationArguments("--no-cache=false"));

        assertTrue(cacheProperties.isEnabled());
    }

    @Test
    void shouldRunWithResolvedToken() {
        when(tokenResolutionService.hasCredentials(runProperties)).thenReturn(true);
        when(tokenResolutionService.resolve(runProperties)).thenReturn("tok");

        runner.run(new DefaultApplicationArguments());

        verify(backupGenerationService).generate("tok", runProperties);
        assertEquals(BackupExitCodeMapper.EXIT_OK, runner.getExitCode());
    }

    @Test
    void shouldUseInteractiveSetupWhenNoCredentialsAndConsoleAttached() {
        when(tokenResolutionService.hasCredentials(runProperties)).thenReturn(false);
        when(interactiveSetupService.isAvailable()).thenReturn(true);
        when(interactiveSetupService.run(runProperties)).thenReturn(new AuthorizationGrant("r", "fresh", "dbid"));

        runner.run(new DefaultApplicationArguments());

        verify(backupGenerationService).generate("fresh", runProperties);
        verify(tokenResolutionService, never()).resolve(runProperties);
    }

    @Test
    void failureShouldSetExitCodeInsteadOfThrowing() {
        when(tokenResolutionService.hasCredentials(runProperties)).thenReturn(true);
        when(tokenResolutionService.resolve(runProperties)).thenThrow(new DropboxAuthException("revoked"));

        runner.run(new DefaultApplicationArguments());

        assertEquals(BackupExitCodeMapper.EXIT_AUTH, runner.getExitCode());
        verify(backupGenerationService, never()).generate(anyString(), any(AppRunProperties.class));
    }
}
