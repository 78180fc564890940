package com.example.earnings.support;

import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.PeriodRecord;

import java.util.ArrayList;
import java.util.List;

public final class TestRecords {

    private TestRecords() {}

    public static PeriodRecord quarter(String entity, String period,
                                       double pbt, double nii, double fee, double opex, double provision,
                                       Double loan) {
        PeriodRecord r = new PeriodRecord(entity, PeriodKind.QUARTERLY, period);
        fill(r, pbt, nii, fee, opex, provision, loan);
        return r;
    }

    public static PeriodRecord year(String entity, String period,
                                    double pbt, double nii, double fee, double opex, double provision,
                                    Double loan) {
        PeriodRecord r = new PeriodRecord(entity, PeriodKind.ANNUAL, period);
        fill(r, pbt, nii, fee, opex, provision, loan);
        return r;
    }

    /** 2023Q1 부터 n 개 연속 분기. PBT 는 100 에서 분기마다 step 씩 증가, 증가분은 모두 NII */
    public static List<PeriodRecord> steadyQuarters(String entity, int n, double step) {
        List<PeriodRecord> out = new ArrayList<>();
        int year = 2023;
        int q = 1;
        for (int i = 0; i < n; i++) {
            double pbt = 100 + step * i;
            out.add(quarter(entity, year + "Q" + q, pbt, 150 + step * i, 50, -80, -30, 1000.0 + 10 * i));
            if (++q > 4) {
                q = 1;
                year++;
            }
        }
        return out;
    }

    private static void fill(PeriodRecord r, double pbt, double nii, double fee, double opex, double provision, Double loan) {
        r.setPbt(pbt);
        r.setNii(nii);
        r.setFee(fee);
        r.setOpex(opex);
        r.setProvision(provision);
        r.setToi(nii + fee + 20);
        r.setLoan(loan);
        r.setNim(3.2);
    }
}
