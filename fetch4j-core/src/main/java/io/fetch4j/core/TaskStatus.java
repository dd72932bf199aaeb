package io.fetch4j.core;

public enum TaskStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCEEDED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
