package com.hunt.jobtracker.ingest.http;

import java.io.IOException;

public interface JobPageFetcher {
    FetchedPage fetch(String url) throws IOException;

    /** Body of a fetched page and the URL it was served from after redirects. */
    record FetchedPage(String html, String finalUrl) {
    }
}
