package com.flagship.credit_ledger.job;

import com.flagship.credit_ledger.credit.CreditLedgerService;
import com.flagship.credit_ledger.credit.IssueCreditCommand;
import com.flagship.credit_ledger.credit.LedgerResult;
import com.flagship.credit_ledger.credit.exception.CreditLedgerException;
import com.flagship.credit_ledger.expiration.ExpirationReminderService;
import com.flagship.credit_ledger.expiration.ExpirationSweeper;
import com.flagship.credit_ledger.expiration.ReminderResult;
import com.flagship.credit_ledger.expiration.SweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes {@link LedgerJob}s against the ledger service. A job never throws for a
 * per-item failure; failures are counted and described in the {@link JobOutcome}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerJobRunner {

    private final CreditLedgerService creditLedgerService;
    private final ExpirationSweeper sweeper;
    private final ExpirationReminderService reminderService;

    public JobOutcome run(LedgerJob job) {
        JobOutcome outcome = job.accept(new LedgerJob.Visitor<>() {
            @Override
            public JobOutcome visitIssue(IssueJob issueJob) {
                return runIssue(issueJob);
            }

            @Override
            public JobOutcome visitExpireSweep(ExpireSweepJob sweepJob) {
                return runSweep(sweepJob);
            }

            @Override
            public JobOutcome visitNotify(NotifyJob notifyJob) {
                return runNotify(notifyJob);
            }
        });
        log.info("Job {} finished: succeeded={}, failed={}", outcome.getJobType(), outcome.getSucceeded(), outcome.getFailed());
        return outcome;
    }

    private JobOutcome runIssue(IssueJob job) {
        int succeeded = 0;
        List<String> messages = new ArrayList<>();
        List<IssueCreditCommand> commands = job.getCommands();
        for (int i = 0; i < commands.size(); i++) {
            try {
                LedgerResult result = creditLedgerService.issue(commands.get(i));
                succeeded++;
                messages.add(String.format("#%d issued %s", i, result.getCredit().getCode()));
            } catch (CreditLedgerException e) {
                messages.add(String.format("#%d failed (%s): %s", i, e.getKind(), e.getMessage()));
            } catch (IllegalArgumentException e) {
                messages.add(String.format("#%d rejected: %s", i, e.getMessage()));
            }
        }
        return new JobOutcome("issue", succeeded, commands.size() - succeeded, List.copyOf(messages));
    }

    private JobOutcome runSweep(ExpireSweepJob job) {
        SweepResult result = sweeper.sweepExpired(job.getAsOf());
        List<String> messages = new ArrayList<>();
        if (result.getSkippedCount() > 0) {
            messages.add(result.getSkippedCount() + " credit(s) already terminal");
        }
        result.getFailures().forEach(failure -> messages.add(String.format("%s failed (%s): %s",
            failure.getCreditId(), failure.getKind(), failure.getMessage())));
        return new JobOutcome("expire-sweep", result.getExpiredCount(), result.getFailures().size(), List.copyOf(messages));
    }

    private JobOutcome runNotify(NotifyJob job) {
        ReminderResult result = reminderService.sendReminders(job.getAsOf(), job.getDaysUntil());
        return new JobOutcome("notify", result.getSent(), result.getFailed(),
            List.of(String.format("%d credit(s) expiring in %d day(s)", result.getCandidates(), result.getDaysUntil())));
    }
}
