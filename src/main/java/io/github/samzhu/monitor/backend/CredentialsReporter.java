package io.github.samzhu.monitor.backend;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.auth.oauth2.UserCredentials;

/**
 * 啟動時記錄目前使用的 Application Default Credentials 類型。
 *
 * <p>找不到憑證時只記錄錯誤與處理方式，不中止程序；後續查詢會以授權失敗結束。
 */
@Component
public class CredentialsReporter {

    private static final Logger log = LoggerFactory.getLogger(CredentialsReporter.class);

    public void logActiveCredentials() {
        try {
            GoogleCredentials credentials = GoogleCredentials.getApplicationDefault();
            log.info("Authentication successful. Using credentials of type: {}", describe(credentials));
        } catch (IOException e) {
            log.error("Authentication failed. Could not find default credentials: {}", e.getMessage());
            log.error("Please run 'gcloud auth application-default login' or set the "
                + "GOOGLE_APPLICATION_CREDENTIALS environment variable.");
        }
    }

    static String describe(GoogleCredentials credentials) {
        if (credentials instanceof ServiceAccountCredentials serviceAccount) {
            return "Service Account: " + serviceAccount.getClientEmail();
        }
        if (credentials instanceof UserCredentials) {
            // 使用者憑證不提供 email
            return "User Credentials";
        }
        return credentials.getClass().getSimpleName();
    }
}
