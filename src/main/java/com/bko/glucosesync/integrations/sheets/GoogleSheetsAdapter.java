package com.bko.glucosesync.integrations.sheets;

import com.bko.glucosesync.shared.AppSettings;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.api.services.sheets.v4.model.AddSheetRequest;
import com.google.api.services.sheets.v4.model.AppendValuesResponse;
import com.google.api.services.sheets.v4.model.BatchUpdateSpreadsheetRequest;
import com.google.api.services.sheets.v4.model.ClearValuesRequest;
import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.Sheet;
import com.google.api.services.sheets.v4.model.SheetProperties;
import com.google.api.services.sheets.v4.model.Spreadsheet;
import com.google.api.services.sheets.v4.model.ValueRange;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;

/**
 * Google Sheets v4 implementation of {@link SpreadsheetPort}, authenticated with a service account key. The client is
 * built on first use so the application starts without Google configuration.
 */
@Component
public class GoogleSheetsAdapter implements SpreadsheetPort {
    private static final Logger logger = LoggerFactory.getLogger(GoogleSheetsAdapter.class);
    private static final String VALUE_INPUT = "RAW";

    private final AppSettings settings;
    private Sheets client;

    @Autowired
    public GoogleSheetsAdapter(AppSettings settings) {
        this(settings, null);
    }

    GoogleSheetsAdapter(AppSettings settings, Sheets client) {
        this.settings = settings;
        this.client = client;
    }

    @Override
    public List<List<Object>> readRows(String range) throws IOException {
        List<List<Object>> rows = values().get(spreadsheetId(), range).execute().getValues();
        return rows == null ? List.of() : rows;
    }

    @Override
    public void appendRows(String range, List<List<Object>> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        AppendValuesResponse response = values()
                .append(spreadsheetId(), range, new ValueRange().setValues(rows))
                .setValueInputOption(VALUE_INPUT)
                .execute();
        if (response != null && response.getUpdates() != null) {
            logger.debug("Sheets reported {} updated rows in {}.", response.getUpdates().getUpdatedRows(), range);
        }
    }

    @Override
    public void rewriteRows(String sheetName, List<List<Object>> rows) throws IOException {
        String id = spreadsheetId();
        values().clear(id, sheetName + "!A2:Z", new ClearValuesRequest()).execute();
        if (!rows.isEmpty()) {
            values().update(id, sheetName + "!A2", new ValueRange().setValues(rows))
                    .setValueInputOption(VALUE_INPUT)
                    .execute();
        }
        logger.info("Rewrote {} with {} rows.", sheetName, rows.size());
    }

    @Override
    public void writeHeaderRow(String sheetName, List<Object> headers) throws IOException {
        String headerRange = sheetName + "!1:1";
        List<List<Object>> existing = readRows(headerRange);
        if (!existing.isEmpty() && sameHeaders(existing.get(0), headers)) {
            return;
        }
        logger.info("Writing header row to {}.", sheetName);
        values().update(spreadsheetId(), headerRange, new ValueRange().setValues(List.of(headers)))
                .setValueInputOption(VALUE_INPUT)
                .execute();
    }

    @Override
    public void addSheetIfMissing(String sheetName) throws IOException {
        String id = spreadsheetId();
        Spreadsheet spreadsheet = sheets().spreadsheets().get(id).setFields("sheets.properties.title").execute();
        List<Sheet> existing = spreadsheet.getSheets();
        if (existing != null) {
            for (Sheet sheet : existing) {
                if (sheet.getProperties() != null && sheetName.equals(sheet.getProperties().getTitle())) {
                    return;
                }
            }
        }
        Request addSheet = new Request().setAddSheet(
                new AddSheetRequest().setProperties(new SheetProperties().setTitle(sheetName)));
        sheets().spreadsheets()
                .batchUpdate(id, new BatchUpdateSpreadsheetRequest().setRequests(List.of(addSheet)))
                .execute();
        logger.info("Added sheet {}.", sheetName);
    }

    static boolean sameHeaders(List<Object> current, List<Object> expected) {
        if (current.size() < expected.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            Object cell = current.get(i);
            if (cell == null || !expected.get(i).toString().equalsIgnoreCase(cell.toString())) {
                return false;
            }
        }
        return true;
    }

    private String spreadsheetId() {
        if (!settings.isGoogleConfigured()) {
            throw new IllegalStateException("Google spreadsheet id or service account key is not configured.");
        }
        return settings.google().spreadsheetId();
    }

    private Sheets.Spreadsheets.Values values() throws IOException {
        return sheets().spreadsheets().values();
    }

    private synchronized Sheets sheets() throws IOException {
        if (client == null) {
            client = connect(Path.of(settings.google().serviceAccountKeyPath()));
        }
        return client;
    }

    private static Sheets connect(Path keyFile) throws IOException {
        GoogleCredentials credentials;
        try (InputStream in = Files.newInputStream(keyFile)) {
            credentials = GoogleCredentials.fromStream(in).createScoped(List.of(SheetsScopes.SPREADSHEETS));
        }
        try {
            return new Sheets.Builder(
                    GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(),
                    new HttpCredentialsAdapter(credentials))
                    .setApplicationName("GlucoseSync")
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IOException("Could not create the Sheets transport", e);
        }
    }
}
