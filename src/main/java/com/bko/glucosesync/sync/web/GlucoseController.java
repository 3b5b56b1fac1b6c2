package com.bko.glucosesync.sync.web;

import com.bko.glucosesync.glucose.GlucoseReading;
import com.bko.glucosesync.glucose.GlucoseReadingRepository;
import com.bko.glucosesync.glucose.HybridGlucoseSource;
import com.bko.glucosesync.glucose.ReadingSource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/glucose")
public class GlucoseController {
    private final HybridGlucoseSource hybridSource;
    private final GlucoseReadingRepository repository;

    public GlucoseController(HybridGlucoseSource hybridSource, GlucoseReadingRepository repository) {
        this.hybridSource = hybridSource;
        this.repository = repository;
    }

    /**
     * Queries the upstreams through the hybrid source; {@code stored=true} reads the repository instead.
     */
    @GetMapping("/readings")
    public List<GlucoseReading> readings(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(value = "source", required = false) String source,
            @RequestParam(value = "stored", defaultValue = "false") boolean stored) throws IOException {
        if (!stored) {
            return hybridSource.fetchReadings(start, end);
        }
        ReadingSource filter = source == null || source.isBlank() ? null : ReadingSource.fromTag(source);
        return repository.fetchReadings(start, end, filter);
    }

    @GetMapping("/latest")
    public ResponseEntity<GlucoseReading> latest(
            @RequestParam(value = "stored", defaultValue = "false") boolean stored) throws IOException {
        if (stored) {
            return ResponseEntity.of(repository.fetchLatestReading(null));
        }
        return ResponseEntity.of(hybridSource.fetchLatestReading());
    }
}
