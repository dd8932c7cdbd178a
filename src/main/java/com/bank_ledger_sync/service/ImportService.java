package com.bank_ledger_sync.service;

import com.bank_ledger_sync.dto.AccountReport;
import com.bank_ledger_sync.dto.ImportReport;
import com.bank_ledger_sync.dto.LedgerFileReport;
import com.bank_ledger_sync.model.AccountDownload;
import com.bank_ledger_sync.model.AccountMapping;
import com.bank_ledger_sync.model.ImportConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class ImportService {

    private final ConfigService configService;
    private final DownloadService downloadService;
    private final ReconcileService reconcileService;

    // a download failure fails the whole import, a ledger file failure only marks that file
    public Mono<ImportReport> importTransactions() {
        return Mono.fromCallable(configService::load)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(config -> downloadService.fetchAll(config.allAccountIds())
                        // ledger files are plain blocking IO
                        .publishOn(Schedulers.boundedElastic())
                        .map(downloads -> reconcileAll(config, downloads)));
    }

    public Mono<Map<String, Map<String, AccountMapping>>> configuredAccounts() {
        return Mono.fromCallable(() -> configService.load().getAccounts())
                .subscribeOn(Schedulers.boundedElastic());
    }

    ImportReport reconcileAll(ImportConfig config, Map<String, AccountDownload> downloads) {
        List<LedgerFileReport> files = new ArrayList<>();
        config.getAccounts().forEach((ledgerFile, accounts) -> {
            log.info("Reconciling {} ({} accounts)", ledgerFile, accounts.size());
            files.add(reconcileService.reconcileFile(ledgerFile, accounts, downloads));
        });

        int warnings = files.stream()
                .flatMap(f -> f.accounts().stream())
                .mapToInt(AccountReport::warningCount)
                .sum();
        int failed = (int) files.stream().filter(f -> f.status() == LedgerFileReport.Status.FAILED).count();
        log.info("Import finished: {} ledger files, {} failed, {} warnings", files.size(), failed, warnings);

        return ImportReport.builder()
                .accountsDownloaded(downloads.size())
                .ledgerFiles(files)
                .warningCount(warnings)
                .failedFiles(failed)
                .build();
    }
}
