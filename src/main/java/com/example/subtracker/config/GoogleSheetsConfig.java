package com.example.subtracker.config;

import com.example.subtracker.exception.ConfigException;
import com.example.subtracker.repository.LedgerSchema;
import com.example.subtracker.repository.LedgerStore;
import com.example.subtracker.repository.SheetsTabularStoreFactory;
import com.example.subtracker.repository.TabularStoreFactory;
import com.example.subtracker.util.Constants;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.List;

@Configuration
@Slf4j
public class GoogleSheetsConfig {

    @Value("${google.application-name:sub-tracker}")
    private String applicationName;

    @Value("${google.credentials-path:}")
    private String credentialsPath;

    @Value("${google.reference-spreadsheet-id:}")
    private String referenceSpreadsheetId;

    @Bean
    public GoogleCredentials googleCredentials() throws IOException {
        GoogleCredentials credentials;
        if (credentialsPath != null && !credentialsPath.isEmpty()) {
            try (FileInputStream credentialsStream = new FileInputStream(credentialsPath)) {
                credentials = GoogleCredentials.fromStream(credentialsStream);
                log.info("Using Google credentials from file: {}", credentialsPath);
            } catch (IOException e) {
                log.error("Failed to load Google credentials from file: {}", credentialsPath);
                throw new ConfigException("Failed to load Google credentials from file: " + credentialsPath, e);
            }
        } else {
            log.info("Using default application credentials (GOOGLE_APPLICATION_CREDENTIALS environment variable or GCP default)");
            credentials = GoogleCredentials.getApplicationDefault();
        }
        return credentials.createScoped(List.of(SheetsScopes.SPREADSHEETS));
    }

    @Bean
    public Sheets sheets(GoogleCredentials googleCredentials) throws GeneralSecurityException, IOException {
        HttpCredentialsAdapter credentialsAdapter = new HttpCredentialsAdapter(googleCredentials);
        int timeoutMillis = (int) Constants.Limits.REQUEST_TIMEOUT.toMillis();
        HttpRequestInitializer initializer = request -> {
            credentialsAdapter.initialize(request);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        };

        Sheets sheets = new Sheets.Builder(
                GoogleNetHttpTransport.newTrustedTransport(),
                GsonFactory.getDefaultInstance(),
                initializer)
                .setApplicationName(applicationName)
                .build();
        log.info("Google Sheets client initialized for application: {}", applicationName);
        return sheets;
    }

    @Bean
    public TabularStoreFactory tabularStoreFactory(Sheets sheets) {
        return new SheetsTabularStoreFactory(sheets);
    }

    @Bean
    public LedgerStore referenceLedgerStore(TabularStoreFactory tabularStoreFactory) {
        if (referenceSpreadsheetId == null || referenceSpreadsheetId.isBlank()) {
            throw new ConfigException("Missing required configuration: google.reference-spreadsheet-id");
        }
        LedgerStore store = new LedgerStore(tabularStoreFactory.open(referenceSpreadsheetId), LedgerSchema.REFERENCE);
        log.info("Reference table bound to spreadsheet {}", referenceSpreadsheetId);
        return store;
    }
}
