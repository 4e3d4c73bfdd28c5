package net.kairos.integration.spring.cron;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.field.CronFieldName;
import com.cronutils.model.field.expression.Always;
import com.cronutils.model.field.expression.And;
import com.cronutils.model.field.expression.Between;
import com.cronutils.model.field.expression.FieldExpression;
import com.cronutils.model.field.expression.On;
import com.cronutils.model.field.expression.QuestionMark;
import com.cronutils.model.field.value.IntegerFieldValue;
import com.cronutils.model.field.value.SpecialChar;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.kairos.core.error.InvalidScheduleSpecException;

import java.time.Month;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * cron-utils 파싱 + ExecutionTime 캐시 (Guava 없이 LRU).
 * 5필드는 UNIX(분 단위), 6필드는 Spring(초 포함) 문법.
 */
public final class CronExpressions {
    private static final CronParser UNIX = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SPRING = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    // 간단 LRU(최대 256개)
    private static final Map<String, Parsed> CACHE = new LruMap<>(256);

    private CronExpressions() {}

    public record Parsed(Cron cron, ExecutionTime executionTime) { }

    /** 파싱 + 정적 검증. 실패하면 InvalidScheduleSpecException */
    public static Parsed parse(String cronExpr) {
        Objects.requireNonNull(cronExpr, "cronExpr");
        String key = normalize(cronExpr);
        synchronized (CACHE) {
            Parsed hit = CACHE.get(key);
            if (hit != null) return hit;
        }
        Parsed parsed = doParse(key);
        synchronized (CACHE) {
            CACHE.put(key, parsed);
        }
        return parsed;
    }

    public static String describe(String cronExpr) {
        return CronDescriptor.instance(Locale.UK).describe(parse(cronExpr).cron());
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static String normalize(String cronExpr) {
        return cronExpr.trim().replaceAll("\\s+", " ");
    }

    private static Parsed doParse(String expr) {
        int fields = expr.isEmpty() ? 0 : expr.split(" ").length;
        CronParser parser;
        if (fields == 5) parser = UNIX;
        else if (fields == 6) parser = SPRING;
        else throw new InvalidScheduleSpecException(
                    "cron expression must have 5 or 6 fields, got " + fields + ": '" + expr + "'");

        Cron cron;
        try {
            cron = parser.parse(expr).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleSpecException("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
        rejectImpossibleDayOfMonth(expr, cron);
        return new Parsed(cron, ExecutionTime.forCron(cron));
    }

    /** 예: "0 0 30 2 *", "0 0 31 4 *" 는 문법상 맞지만 영원히 발사되지 않는다 */
    private static void rejectImpossibleDayOfMonth(String expr, Cron cron) {
        FieldExpression dom = cron.retrieve(CronFieldName.DAY_OF_MONTH).getExpression();
        FieldExpression dow = cron.retrieve(CronFieldName.DAY_OF_WEEK).getExpression();
        if (!(dom instanceof On on) || !isUnrestricted(dow)) return;
        if (on.getSpecialChar().getValue() != SpecialChar.NONE) return;
        int day = on.getTime().getValue();

        Set<Month> months = months(cron.retrieve(CronFieldName.MONTH).getExpression());
        boolean possible = months.stream().anyMatch(m -> day <= m.maxLength());
        if (!possible) {
            throw new InvalidScheduleSpecException("cron expression '" + expr + "' never fires: day " + day
                    + " does not exist in months " + months);
        }
    }

    private static boolean isUnrestricted(FieldExpression e) {
        return e instanceof Always || e instanceof QuestionMark;
    }

    /** 월 필드가 허용하는 달. 해석하기 어려운 형태는 전체로 본다 */
    private static Set<Month> months(FieldExpression e) {
        if (e instanceof On on && on.getSpecialChar().getValue() == SpecialChar.NONE) {
            return EnumSet.of(Month.of(on.getTime().getValue()));
        }
        if (e instanceof And and) {
            Set<Month> out = EnumSet.noneOf(Month.class);
            for (FieldExpression part : and.getExpressions()) out.addAll(months(part));
            return out;
        }
        if (e instanceof Between between
                && between.getFrom() instanceof IntegerFieldValue from
                && between.getTo() instanceof IntegerFieldValue to
                && from.getValue() <= to.getValue()) {
            Set<Month> out = EnumSet.noneOf(Month.class);
            for (int m = from.getValue(); m <= to.getValue(); m++) out.add(Month.of(m));
            return out;
        }
        return EnumSet.allOf(Month.class);
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
