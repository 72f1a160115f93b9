package net.legacy.harness.command;

import net.legacy.harness.command.exception.ImportFailureException;
import net.legacy.harness.foundation.test.RunConfiguration;
import net.legacy.harness.foundation.test.TestLoadException;
import net.legacy.harness.foundation.test.Verbosity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TestCommandTest {

    @Mock
    private TestOrchestrator orchestrator;

    private ByteArrayOutputStream err;
    private TestCommand command;

    @BeforeEach
    void setUp() {
        err = new ByteArrayOutputStream();
        command = new TestCommand(orchestrator, new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void clusteredFlagsAndNamesReachTheOrchestrator() throws Exception {
        when(orchestrator.execute(any(), anyList())).thenReturn(0);

        int exitCode = TestCommandLauncher.newCommandLine(command).execute("-lu", "cp", "mv.MvCases");

        ArgumentCaptor<RunConfiguration> configuration = ArgumentCaptor.forClass(RunConfiguration.class);
        verify(orchestrator).execute(configuration.capture(), eq(List.of("cp", "mv.MvCases")));
        assertThat(exitCode).isZero();
        assertThat(configuration.getValue().isListOnly()).isTrue();
        assertThat(configuration.getValue().isUnitOnly()).isTrue();
        assertThat(configuration.getValue().isFailFast()).isFalse();
    }

    @Test
    void exitCodeComesFromTheOrchestrator() throws Exception {
        when(orchestrator.execute(any(), anyList())).thenReturn(1);

        assertThat(TestCommandLauncher.newCommandLine(command).execute("-f")).isEqualTo(1);
        verify(orchestrator).execute(any(), eq(List.of()));
    }

    @Test
    void commandExceptionsArePrintedAndExitWithOne() throws Exception {
        when(orchestrator.execute(any(), anyList()))
                .thenThrow(new ImportFailureException(new TestLoadException("No module named bogus")));

        int exitCode = TestCommandLauncher.newCommandLine(command).execute("bogus");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("CommandException: Invalid test argument name: No module named bogus");
    }

    @Test
    void helpDoesNotRunAnything() {
        int exitCode = TestCommandLauncher.newCommandLine(command).execute("-h");

        assertThat(exitCode).isZero();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void verbosityFollowsRootLogLevel() {
        assertThat(command.toRunConfiguration().getVerbosity()).isEqualTo(Verbosity.DOTS);
    }
}
