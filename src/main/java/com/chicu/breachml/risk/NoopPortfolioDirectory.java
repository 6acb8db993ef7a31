package com.chicu.breachml.risk;

import java.util.List;

public class NoopPortfolioDirectory implements PortfolioDirectory {

    @Override
    public List<String> listEntityIds(String organisationId, int limit) {
        return List.of();
    }
}
