package com.stemtutor.dispatch.cli;

import com.stemtutor.core.ratelimit.RateLimiterUnavailableException;
import com.stemtutor.core.service.TutorService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stemtutor quota &lt;identity&gt; [--reset]
 */
@Command(name = "quota", mixinStandardHelpOptions = true, description = "Show or reset a rate-limit quota")
@Component
public class QuotaCommand implements Runnable {

    @Parameters(index = "0", description = "Identity")
    private String identity;

    @Option(names = {"--reset"}, description = "Restore a full bucket")
    private boolean reset;

    private final TutorService tutorService;

    public QuotaCommand(TutorService tutorService) {
        this.tutorService = tutorService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (reset) {
            try {
                tutorService.resetQuota(identity);
                ConsoleOutput.success("Quota reset for " + identity);
            } catch (RateLimiterUnavailableException e) {
                ConsoleOutput.error("Reset failed: " + e.getMessage());
                return;
            }
        }

        var quota = tutorService.quota(identity);
        ConsoleOutput.info(String.format("%s (%s): %d/%d remaining, window %ds, full in %ds",
                identity, quota.tier(), quota.remaining(), quota.limit(),
                quota.windowSeconds(), quota.resetInSeconds()));
    }
}
