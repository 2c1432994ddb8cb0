package com.my.ingest.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ProfileManager;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = "prod".equals(ProfileManager.getActiveProfile());
        List<String> problems = findProblems();
        for (String problem : problems) {
            if (isProd) {
                throw new IllegalStateException(problem);
            }
            log.warn(problem);
        }
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        boolean anyEnabled = false;
        for (Map.Entry<String, AppConfig.AccountConfig> entry : appConfig.accounts().entrySet()) {
            if (!entry.getValue().enabled()) {
                continue;
            }
            anyEnabled = true;
            problems.addAll(accountProblems(entry.getKey(), entry.getValue()));
        }
        if (!anyEnabled) {
            problems.add("활성화된 계정이 없습니다: app.accounts.<id>.base-url");
        }
        return problems;
    }

    /**
     * 계정 하나를 폴링하는 데 필요한 설정이 모두 있는지 확인한다.
     */
    static List<String> accountProblems(String accountId, AppConfig.AccountConfig account) {
        List<String> problems = new ArrayList<>();
        String prefix = "app.accounts." + accountId;
        if (isBlank(account.baseUrl())) {
            problems.add("필수 설정이 비어 있습니다: " + prefix + ".base-url");
        }
        boolean hasToken = !isBlank(account.token());
        boolean hasExchange = !isBlank(account.tokenUrl())
                && !isBlank(account.clientId())
                && !isBlank(account.clientSecret());
        if (!hasToken && !hasExchange) {
            problems.add("자격 증명 설정이 없습니다: " + prefix + ".token 또는 token-url/client-id/client-secret");
        }
        return problems;
    }

    private static boolean isBlank(Optional<String> value) {
        return value.map(String::isBlank).orElse(true);
    }
}
