package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.config.PipelineProperties;
import com.secpipe.orchestrator.config.PipelineProperties.ToolSettings;
import com.secpipe.orchestrator.correlate.VersionCorrelator;
import com.secpipe.orchestrator.notify.MailNotifier;
import com.secpipe.orchestrator.pipeline.StageDescriptor;
import com.secpipe.orchestrator.publish.ReportPublisher;
import com.secpipe.orchestrator.resource.EphemeralResourceGuard;
import com.secpipe.orchestrator.tool.ToolInvoker;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The DevSecOps stage table, in execution order.
 *
 *   prepare            always      fatal
 *   sast               toggle
 *   dependency-scan    toggle
 *   environment-setup  toggle      fatal   (needs requirements.txt)
 *   unit-tests         toggle              (output feeds the version status)
 *   image-build        toggle      fatal   (needs the Dockerfile)
 *   image-scan         image-build
 *   dast-deploy        toggle              (released after dast-scan)
 *   dast-scan          toggle
 *   correlate          always
 *   report-publish     toggle
 *   notification       toggle
 *
 * Which stages are fatal comes from {@code secpipe.fatal-stages}; the defaults
 * are the three marked above.
 */
@Component
public class StandardStages {

    public static final String PREPARE           = "prepare";
    public static final String SAST              = "sast";
    public static final String DEPENDENCY_SCAN   = "dependency-scan";
    public static final String ENVIRONMENT_SETUP = "environment-setup";
    public static final String UNIT_TESTS        = "unit-tests";
    public static final String IMAGE_BUILD       = "image-build";
    public static final String IMAGE_SCAN        = "image-scan";
    public static final String DAST_DEPLOY       = "dast-deploy";
    public static final String DAST_SCAN         = "dast-scan";
    public static final String CORRELATE         = "correlate";
    public static final String REPORT_PUBLISH    = "report-publish";
    public static final String NOTIFICATION      = "notification";

    private final PipelineProperties     props;
    private final ToolInvoker            tools;
    private final VersionCorrelator      correlator;
    private final ReportPublisher        publisher;
    private final MailNotifier           notifier;
    private final EphemeralResourceGuard guard;

    public StandardStages(PipelineProperties props,
                          ToolInvoker tools,
                          VersionCorrelator correlator,
                          ReportPublisher publisher,
                          MailNotifier notifier,
                          EphemeralResourceGuard guard) {
        this.props      = props;
        this.tools      = tools;
        this.correlator = correlator;
        this.publisher  = publisher;
        this.notifier   = notifier;
        this.guard      = guard;
    }

    /** A fresh descriptor list; each call builds new action instances. */
    public List<StageDescriptor> descriptors() {
        String spaceKey = props.documentation().spaceKey();
        DastDeployAction deploy = new DastDeployAction(guard, props.dast(), props.image().tag());

        return List.of(
                StageDescriptor.always(PREPARE, fatal(PREPARE), new PrepareAction(props.workspace())),
                command(SAST, SAST, false),
                command(DEPENDENCY_SCAN, DEPENDENCY_SCAN, false),
                command(ENVIRONMENT_SETUP, ENVIRONMENT_SETUP, false),
                command(UNIT_TESTS, UNIT_TESTS, true),
                StageDescriptor.toggled(IMAGE_BUILD, IMAGE_BUILD, fatal(IMAGE_BUILD),
                        new CommandStageAction(IMAGE_BUILD,
                                settings(IMAGE_BUILD).requiring(props.image().dockerfile()),
                                tools, props.workspace(), false)),
                command(IMAGE_SCAN, IMAGE_BUILD, false),
                StageDescriptor.toggled(DAST_DEPLOY, DAST_DEPLOY, fatal(DAST_DEPLOY), deploy)
                        .withCleanup(deploy.cleanup(), DAST_SCAN),
                StageDescriptor.toggled(DAST_SCAN, DAST_SCAN, fatal(DAST_SCAN),
                        new DastScanAction(tools, props.dast())),
                StageDescriptor.always(CORRELATE, fatal(CORRELATE),
                        new CorrelateAction(correlator, tools, props.reportTitle(), props.reportBasename(),
                                props.pdfCommand(), props.pdfTimeout())),
                StageDescriptor.toggled(REPORT_PUBLISH, REPORT_PUBLISH, fatal(REPORT_PUBLISH),
                        new PublishAction(publisher, spaceKey)),
                StageDescriptor.toggled(NOTIFICATION, NOTIFICATION, fatal(NOTIFICATION),
                        new NotifyAction(notifier, publisher, props.mail().to(), props.reportTitle(), spaceKey))
        );
    }

    /** Every toggle key the table uses, in declaration order. */
    public static Set<String> toggleNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(SAST);
        names.add(DEPENDENCY_SCAN);
        names.add(ENVIRONMENT_SETUP);
        names.add(UNIT_TESTS);
        names.add(IMAGE_BUILD);
        names.add(DAST_DEPLOY);
        names.add(DAST_SCAN);
        names.add(REPORT_PUBLISH);
        names.add(NOTIFICATION);
        return names;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageDescriptor command(String stage, String toggle, boolean recordsTestOutput) {
        return StageDescriptor.toggled(stage, toggle, fatal(stage),
                new CommandStageAction(stage, settings(stage), tools, props.workspace(), recordsTestOutput));
    }

    private ToolSettings settings(String stage) {
        ToolSettings configured = props.tools().get(stage);
        return configured != null ? configured : new ToolSettings(null, null, null, null, false, null);
    }

    private boolean fatal(String stage) {
        return props.fatalStages().contains(stage);
    }
}
