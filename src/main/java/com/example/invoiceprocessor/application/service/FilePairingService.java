package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.application.extraction.FormatDetector;
import com.example.invoiceprocessor.domain.model.FilePair;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.PairingResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposes PDF/text pairs by filename similarity.
 * <p>
 * PDFs are visited in input order and each takes the best unconsumed companion scoring at least the
 * configured threshold (ties go to the lexically smallest file name). Assignment is greedy and a
 * companion is never assigned twice.
 * <p>
 * Names that both carry numbers must agree on them: every digit run of the name with fewer runs has
 * to appear in the other name, so {@code invoice_100.pdf} never pairs with {@code invoice_200.txt}.
 */
@Service
public class FilePairingService {

    private static final Logger log = LoggerFactory.getLogger(FilePairingService.class);
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    private final FormatDetector formatDetector;
    private final double threshold;

    public FilePairingService(FormatDetector formatDetector, ProcessingSettings settings) {
        this.formatDetector = formatDetector;
        this.threshold = settings.pairingThreshold();
    }

    /**
     * Splits the files into PDFs and companions and pairs them.
     *
     * @param files uploaded files
     * @return pairs in resolution order plus unmatched PDFs followed by unused companions
     */
    public PairingResult resolvePairs(List<InvoiceFile> files) {
        List<InvoiceFile> pdfs = new ArrayList<>();
        List<InvoiceFile> companions = new ArrayList<>();
        for (InvoiceFile file : files) {
            if (formatDetector.detect(file) == InputFormat.PDF_TEXT) {
                pdfs.add(file);
            } else {
                companions.add(file);
            }
        }

        boolean[] consumed = new boolean[companions.size()];
        List<FilePair> pairs = new ArrayList<>();
        List<InvoiceFile> unmatched = new ArrayList<>();
        for (InvoiceFile pdf : pdfs) {
            String pdfName = normalizeName(pdf.fileName());
            List<String> pdfNumbers = digitRuns(pdf.fileName());
            int best = -1;
            double bestScore = -1;
            for (int i = 0; i < companions.size(); i++) {
                if (consumed[i]) {
                    continue;
                }
                double score = similarity(pdfName, normalizeName(companions.get(i).fileName()));
                if (score < threshold || !numbersAgree(pdfNumbers, digitRuns(companions.get(i).fileName()))) {
                    continue;
                }
                if (score > bestScore
                        || (score == bestScore && nameOf(companions.get(i)).compareTo(nameOf(companions.get(best))) < 0)) {
                    best = i;
                    bestScore = score;
                }
            }
            if (best < 0) {
                log.info("No companion file for {} reached similarity {}", pdf.fileName(), threshold);
                unmatched.add(pdf);
            } else {
                consumed[best] = true;
                pairs.add(new FilePair(pdf, companions.get(best), bestScore));
                log.debug("Paired {} with {} (score {})", pdf.fileName(), companions.get(best).fileName(), bestScore);
            }
        }
        for (int i = 0; i < companions.size(); i++) {
            if (!consumed[i]) {
                unmatched.add(companions.get(i));
            }
        }
        return new PairingResult(pairs, unmatched);
    }

    /**
     * Drops the extension, lower-cases and removes every non-alphanumeric character.
     *
     * @param fileName original file name
     * @return comparison key, possibly empty
     */
    static String normalizeName(String fileName) {
        return NON_ALPHANUMERIC.matcher(baseName(fileName).toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * @return digit runs of the base name in order, without leading zeros
     */
    static List<String> digitRuns(String fileName) {
        List<String> runs = new ArrayList<>();
        Matcher matcher = DIGIT_RUN.matcher(baseName(fileName));
        while (matcher.find()) {
            runs.add(matcher.group().replaceFirst("^0+(?=\\d)", ""));
        }
        return runs;
    }

    static boolean numbersAgree(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return true;
        }
        return a.size() <= b.size() ? b.containsAll(a) : a.containsAll(b);
    }

    private static String baseName(String fileName) {
        if (fileName == null) {
            return "";
        }
        String base = fileName;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base;
    }

    /**
     * Longest-common-substring ratio {@code 2 * lcs / (|a| + |b|)}.
     *
     * @return similarity in {@code [0, 1]}; zero when either name is empty
     */
    static double similarity(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        return 2.0 * longestCommonSubstring(a, b) / (a.length() + b.length());
    }

    static int longestCommonSubstring(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        int longest = 0;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                current[j] = a.charAt(i - 1) == b.charAt(j - 1) ? previous[j - 1] + 1 : 0;
                longest = Math.max(longest, current[j]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return longest;
    }

    private static String nameOf(InvoiceFile file) {
        return file.fileName() == null ? "" : file.fileName();
    }
}
