package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.model.PayRange;
import com.hunt.jobtracker.ingest.model.SplitPosting;
import com.hunt.jobtracker.ingest.util.JobUrlUtils;
import org.springframework.stereotype.Component;

/**
 * Assembles a {@link ParsedJob} from a split summary line plus the fields derived from its
 * text: pay range, job code, closure flag and the de-tracked URL.
 */
@Component
public class ParsedJobFactory {
    private final PayRangeExtractor payRangeExtractor;
    private final JobCodeExtractor jobCodeExtractor;
    private final ClosedPostingDetector closedPostingDetector;

    public ParsedJobFactory(
        PayRangeExtractor payRangeExtractor,
        JobCodeExtractor jobCodeExtractor,
        ClosedPostingDetector closedPostingDetector
    ) {
        this.payRangeExtractor = payRangeExtractor;
        this.jobCodeExtractor = jobCodeExtractor;
        this.closedPostingDetector = closedPostingDetector;
    }

    public ParsedJob create(SplitPosting split, String href, String rawText, JobSource source) {
        return create(split, href, rawText, rawText, source);
    }

    /**
     * @param payText text scanned for the pay range; generic alerts scan the whole email
     *                while the record keeps only an excerpt as raw text
     */
    public ParsedJob create(SplitPosting split, String href, String rawText, String payText, JobSource source) {
        String url = JobUrlUtils.cleanTrackingUrl(href).orElse(null);
        PayRange pay = payRangeExtractor.extractPayRange(payText);
        String jobCode = jobCodeExtractor.extractJobCode(rawText)
            .or(() -> jobCodeExtractor.extractJobCode(href))
            .orElse(null);
        return new ParsedJob(
            split.title(),
            split.employer(),
            url,
            split.location(),
            pay.min(),
            pay.max(),
            jobCode,
            closedPostingDetector.detectClosed(rawText),
            source,
            rawText
        );
    }
}
