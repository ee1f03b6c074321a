package com.iimsoft.gantt.service;

import java.nio.file.Path;
import java.util.List;

import com.iimsoft.gantt.domain.ScheduleSolution;

public final class SolveReport {

    private final TerminalStatus status;
    private final List<ScheduleSolution> solutionList;
    private final List<Path> writtenFileList;

    public SolveReport(TerminalStatus status, List<ScheduleSolution> solutionList, List<Path> writtenFileList) {
        this.status = status;
        this.solutionList = List.copyOf(solutionList);
        this.writtenFileList = List.copyOf(writtenFileList);
    }

    public TerminalStatus getStatus() {
        return status;
    }

    /**
     * Best first.
     */
    public List<ScheduleSolution> getSolutionList() {
        return solutionList;
    }

    public List<Path> getWrittenFileList() {
        return writtenFileList;
    }

}
