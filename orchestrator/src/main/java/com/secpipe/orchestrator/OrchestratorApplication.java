package com.secpipe.orchestrator;

import com.secpipe.orchestrator.config.PipelineProperties;
import com.secpipe.orchestrator.pipeline.PipelineRun;
import com.secpipe.orchestrator.pipeline.RunOutcome;
import com.secpipe.orchestrator.service.RunDispatcher;
import com.secpipe.orchestrator.service.RunService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(OrchestratorApplication.class, args);

        // CI mode (secpipe.run-on-startup=true, see the "cli" profile): run the
        // pipeline once with the configured toggles and exit 1 on FAILURE.
        if (context.getBean(PipelineProperties.class).runOnStartup()) {
            int exitCode = runOnce(context);
            System.exit(SpringApplication.exit(context, () -> exitCode));
        }
    }

    static int runOnce(ConfigurableApplicationContext context) {
        RunService    runService = context.getBean(RunService.class);
        RunDispatcher dispatcher = context.getBean(RunDispatcher.class);

        PipelineRun run = dispatcher.runSynchronously(runService.create(Map.of()).getId());
        return run.getOutcome() == RunOutcome.FAILURE ? 1 : 0;
    }
}
