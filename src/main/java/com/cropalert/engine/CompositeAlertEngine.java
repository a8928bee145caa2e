package com.cropalert.engine;

import com.cropalert.config.EngineSettings;
import com.cropalert.core.RunTelemetry;
import com.cropalert.engine.gate.CanopyReadinessGate;
import com.cropalert.engine.gate.GateState;
import com.cropalert.engine.gate.QcDecision;
import com.cropalert.engine.gate.QualityGate;
import com.cropalert.engine.merge.EventMerger;
import com.cropalert.engine.metric.MetricResolver;
import com.cropalert.engine.rule.RuleClassifier;
import com.cropalert.engine.support.SupportWindow;
import com.cropalert.engine.support.SupportWindowResolver;
import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DailyTable;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.MergedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：CompositeAlertEngine（class）。
 * 主要职责：串联指标解析、遥感支持窗口、质量门、冠层门控、规则分类（原始/门控两遍）与事件合并。
 * 实现要点：单线程纯函数式批处理；相同输入与配置得到完全相同的结果，不修改调用方传入的表。
 * 使用建议：配置错误在构造 {@link EngineSettings} 时已抛出，本类只处理已校验的设置。
 */
public final class CompositeAlertEngine {
    private static final Logger LOG = LogManager.getLogger(CompositeAlertEngine.class);

    private final EngineSettings settings;
    private final MetricResolver metricResolver;
    private final SupportWindowResolver supportResolver;
    private final QualityGate qualityGate;
    private final CanopyReadinessGate canopyGate;
    private final RuleClassifier classifier;
    private final EventMerger merger;

    public CompositeAlertEngine(EngineSettings settings) {
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.metricResolver = new MetricResolver();
        this.supportResolver = new SupportWindowResolver(this.settings.window);
        this.qualityGate = new QualityGate(this.settings.qc);
        this.canopyGate = new CanopyReadinessGate(this.settings.gating);
        this.classifier = new RuleClassifier(this.settings.thresholds);
        this.merger = new EventMerger(this.settings.thresholds, classifier.rules());
    }

    public EngineSettings settings() {
        return settings;
    }

    public EngineResult run(DailyTable table) {
        return run(table, null);
    }

    public EngineResult run(DailyTable table, RunTelemetry telemetry) {
        start(telemetry, RunTelemetry.STEP_RESOLVE_METRICS);
        List<DailyRecord> records = metricResolver.resolve(table);
        end(telemetry, RunTelemetry.STEP_RESOLVE_METRICS, table.size(), records.size());
        return run(records, telemetry);
    }

    public EngineResult run(List<DailyRecord> records, RunTelemetry telemetry) {
        start(telemetry, RunTelemetry.STEP_SUPPORT_WINDOW);
        List<SupportWindow> support = supportResolver.resolve(records);
        end(telemetry, RunTelemetry.STEP_SUPPORT_WINDOW, records.size(),
                support.stream().filter(s -> s.windowOk).count());

        start(telemetry, RunTelemetry.STEP_QC_GATING);
        List<DebugRecord> debug = buildDebug(records, support);
        long qcOk = debug.stream().filter(d -> d.qcOk).count();
        long allowed = debug.stream().filter(d -> d.allowAlert).count();
        end(telemetry, RunTelemetry.STEP_QC_GATING, records.size(), allowed);

        start(telemetry, RunTelemetry.STEP_CLASSIFY);
        List<AlertRecord> raw = classifier.classifyAll(records, debug, false);
        List<AlertRecord> gated = classifier.classifyAll(records, debug, true);
        end(telemetry, RunTelemetry.STEP_CLASSIFY, qcOk, gated.size());

        start(telemetry, RunTelemetry.STEP_MERGE_EVENTS);
        List<MergedEvent> events = merger.merge(gated, records);
        end(telemetry, RunTelemetry.STEP_MERGE_EVENTS, gated.size(), events.size());

        if (telemetry != null) {
            telemetry.setDayStats(records.size(), (int) qcOk, (int) allowed);
            telemetry.setAlertStats(raw.size(), gated.size(), events.size());
        }
        LOG.info("engine run: days={} qc_ok={} allow_alert={} raw_alerts={} gated_alerts={} events={}",
                records.size(), qcOk, allowed, raw.size(), gated.size(), events.size());
        return new EngineResult(records, debug, raw, gated, events);
    }

    List<DebugRecord> buildDebug(List<DailyRecord> records, List<SupportWindow> support) {
        List<GateState> gates = canopyGate.scan(records);
        List<DebugRecord> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            DailyRecord record = records.get(i);
            SupportWindow window = support.get(i);
            QcDecision qc = qualityGate.evaluate(record, window);
            GateState gate = gates.get(i);
            LocalDate supportDate = window.windowOk ? window.supportDate : null;
            out.add(DebugRecord.builder()
                    .date(record.date)
                    .realObsDay(gate.realObsDay)
                    .rsSupportDate(supportDate)
                    .rsSupportAge(supportDate == null ? DebugRecord.NO_SUPPORT_AGE : window.age)
                    .rsWindowOk(window.windowOk)
                    .missingRemote(qc.missingRemote)
                    .missingWeather(qc.missingWeather)
                    .qcOk(qc.qcOk())
                    .skipReason(qc.skipReason)
                    .canopyObsStreak(gate.canopyObsStreak)
                    .canopyObsReady(gate.canopyObsReady)
                    .monthOk(gate.monthOk)
                    .gatingOk(gate.gatingOk)
                    .allowAlert(qc.qcOk() && gate.gatingOk)
                    .build());
        }
        return out;
    }

    private static void start(RunTelemetry telemetry, String step) {
        if (telemetry != null) {
            telemetry.startStep(step);
        }
    }

    private static void end(RunTelemetry telemetry, String step, long in, long out) {
        if (telemetry != null) {
            telemetry.endStep(step, in, out, 0L);
        }
    }
}
