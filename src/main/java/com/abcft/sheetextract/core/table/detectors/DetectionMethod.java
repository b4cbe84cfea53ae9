package com.abcft.sheetextract.core.table.detectors;

/**
 * Table region detection strategies, declared in the order they are tried.
 */
public enum DetectionMethod {
    FROZEN_PANES {
        @Override
        public String getAlgorithmName() {
            return FrozenPanesDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return FrozenPanesDetectionAlgorithm.INSTANCE;
        }
    },
    FINANCIAL_STATEMENT {
        @Override
        public String getAlgorithmName() {
            return FinancialStatementDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return FinancialStatementDetectionAlgorithm.INSTANCE;
        }
    },
    BLANK_ROW_SEPARATION {
        @Override
        public String getAlgorithmName() {
            return BlankRowSeparationDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return BlankRowSeparationDetectionAlgorithm.INSTANCE;
        }
    },
    TEMPORAL_HEADERS {
        @Override
        public String getAlgorithmName() {
            return TemporalHeadersDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return TemporalHeadersDetectionAlgorithm.INSTANCE;
        }
    },
    COLUMN_CONTINUITY {
        @Override
        public String getAlgorithmName() {
            return ColumnContinuityDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return ColumnContinuityDetectionAlgorithm.INSTANCE;
        }
    },
    MULTIROW_HEADERS {
        @Override
        public String getAlgorithmName() {
            return MultiRowHeadersDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return MultiRowHeadersDetectionAlgorithm.INSTANCE;
        }
    },
    GAPS {
        @Override
        public String getAlgorithmName() {
            return GapsDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return GapsDetectionAlgorithm.INSTANCE;
        }
    },
    FORMATTING {
        @Override
        public String getAlgorithmName() {
            return FormattingDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return FormattingDetectionAlgorithm.INSTANCE;
        }
    },
    CONTENT_STRUCTURE {
        @Override
        public String getAlgorithmName() {
            return ContentStructureDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return ContentStructureDetectionAlgorithm.INSTANCE;
        }
    },
    DEFAULT {
        @Override
        public String getAlgorithmName() {
            return DefaultDetectionAlgorithm.ALGORITHM_NAME;
        }

        @Override
        public DetectionAlgorithm getDetectionAlgorithm() {
            return DefaultDetectionAlgorithm.INSTANCE;
        }
    };

    /**
     * Name of the strategy, as reported in table metadata.
     */
    public abstract String getAlgorithmName();

    public abstract DetectionAlgorithm getDetectionAlgorithm();

    public static DetectionMethod fromAlgorithmName(String name) {
        for (DetectionMethod method : values()) {
            if (method.getAlgorithmName().equalsIgnoreCase(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + name);
    }

    public static String formatNames() {
        StringBuilder sb = new StringBuilder();
        for (DetectionMethod method : values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(method.getAlgorithmName());
        }
        return sb.toString();
    }

}
