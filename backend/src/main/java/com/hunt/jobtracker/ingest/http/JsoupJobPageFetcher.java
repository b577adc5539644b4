package com.hunt.jobtracker.ingest.http;

import com.hunt.jobtracker.config.HuntProperties;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class JsoupJobPageFetcher implements JobPageFetcher {
    private final HuntProperties properties;

    public JsoupJobPageFetcher(HuntProperties properties) {
        this.properties = properties;
    }

    @Override
    public FetchedPage fetch(String url) throws IOException {
        Connection.Response response = Jsoup.connect(url)
            .userAgent(properties.getUserAgent())
            .timeout(properties.getRequestTimeoutSeconds() * 1000)
            .followRedirects(true)
            .execute();
        return new FetchedPage(response.body(), response.url().toString());
    }
}
