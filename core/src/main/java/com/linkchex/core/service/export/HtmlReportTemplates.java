package com.linkchex.core.service.export;

import java.util.Locale;

final class HtmlReportTemplates {
    private HtmlReportTemplates() {}

    /** 인쇄(PDF)에서도 그대로 쓰이므로 라이트 팔레트 하나만 둔다. */
    static String css() {
        return """
        <style>
        :root{
          --ink:#1e293b; --soft:#64748b; --paper:#fcfcfd; --panel:#f1f5f9; --line:#d5dde7; --zebra:#f7f9fb;
          --ok:#15803d; --warn:#b45309; --bad:#b91c1c; --skip:#6b7280; --cancel:#6d28d9;
          --accent:#0f766e;
        }
        body{margin:0;background:var(--paper);color:var(--ink);font:13px/1.5 "Segoe UI",Helvetica,Arial,sans-serif}
        a{color:var(--accent)}
        .muted{color:var(--soft)}
        .wrap{max-width:1200px;margin:0 auto;padding:8px 20px 40px}

        /* 상단 */
        .top{background:var(--panel);border-bottom:3px solid var(--accent);padding:14px 20px}
        .top h1{margin:0;font-size:19px;letter-spacing:.3px}

        /* 요약 카드 */
        .cards{display:flex;flex-wrap:wrap;gap:8px;margin:14px 0 10px}
        .card{flex:0 0 auto;min-width:110px;padding:8px 14px;border-left:4px solid var(--line);background:var(--panel)}
        .card .n{font-size:20px;font-weight:700}
        .card .l{font-size:11px;color:var(--soft);text-transform:uppercase}
        .card.ok{border-left-color:var(--ok)} .card.warn{border-left-color:var(--warn)} .card.bad{border-left-color:var(--bad)}
        .card.ok .n{color:var(--ok)} .card.warn .n{color:var(--warn)} .card.bad .n{color:var(--bad)}

        .bar{display:flex;height:10px;margin:6px 0 14px;background:var(--line)}
        .bar>i{height:10px}

        .c-SUCCESS{color:var(--ok)}
        .c-WARNING{color:var(--warn);font-weight:600}
        .c-BROKEN{color:var(--bad);font-weight:700}
        .c-SKIPPED{color:var(--skip)}
        .c-CANCELLED{color:var(--cancel);font-style:italic}

        /* 결과 표 */
        table{width:100%;border-collapse:collapse;font-size:12px}
        th,td{padding:6px 8px;border:1px solid var(--line);vertical-align:top;text-align:left}
        th{background:var(--panel);font-weight:700}
        tr:nth-child(even) td{background:var(--zebra)}
        .url{word-break:break-all}

        .toolbar{display:flex;gap:6px;margin:10px 0}
        .toolbar input,.toolbar select{padding:4px 6px;border:1px solid var(--line);font:inherit}
        .toolbar input{flex:1}
        th.sortable{cursor:pointer}
        th.sorted-asc::after{content:" \\2191"}
        th.sorted-desc::after{content:" \\2193"}

        @media print{
          .toolbar{display:none}
          .top{border-bottom-width:1px}
          a{color:var(--ink);text-decoration:none}
        }
        </style>
        """;
    }

    /** 검색어 + 분류 필터 + 헤더 클릭 정렬 */
    static String script() {
        return """
        <script>
        (function(){
          var q=document.getElementById('q'), f=document.getElementById('cls'), tb=document.querySelector('#results tbody');
          function apply(){
            var s=(q.value||'').toLowerCase(), c=f.value;
            Array.prototype.forEach.call(tb.rows,function(r){
              var okText=!s||r.textContent.toLowerCase().indexOf(s)>=0;
              var okCls=!c||r.getAttribute('data-cls')===c;
              r.style.display=(okText&&okCls)?'':'none';
            });
          }
          q.addEventListener('input',apply); f.addEventListener('change',apply);
          document.querySelectorAll('#results th.sortable').forEach(function(th,idx){
            th.addEventListener('click',function(){
              var asc=!th.classList.contains('sorted-asc'), num=th.hasAttribute('data-num');
              document.querySelectorAll('#results th').forEach(function(x){x.classList.remove('sorted-asc','sorted-desc');});
              th.classList.add(asc?'sorted-asc':'sorted-desc');
              var rows=Array.prototype.slice.call(tb.rows);
              rows.sort(function(a,b){
                var x=a.cells[idx].getAttribute('data-v')||a.cells[idx].textContent;
                var y=b.cells[idx].getAttribute('data-v')||b.cells[idx].textContent;
                var d=num?(parseFloat(x)-parseFloat(y)):x.localeCompare(y);
                return asc?d:-d;
              });
              rows.forEach(function(r){tb.appendChild(r);});
            });
          });
        })();
        </script>
        """;
    }

    static String header(String title, String subtitle) {
        return """
        <div class="top" id="top">
          <h1>%s</h1>
          <span class="muted">%s</span>
        </div>
        <div class="wrap">
        """.formatted(esc(title), esc(subtitle));
    }

    static String card(String cls, String label, String value) {
        return "<div class='card " + cls + "'><div class='n'>" + esc(value) + "</div><div class='l'>"
                + esc(label) + "</div></div>\n";
    }

    static String summaryBar(int success, int warning, int broken) {
        int total = Math.max(0, success) + Math.max(0, warning) + Math.max(0, broken);
        if (total == 0) return "<div class='bar'></div>\n";
        StringBuilder sb = new StringBuilder("<div class='bar'>");
        segment(sb, success, total, "ok");
        segment(sb, warning, total, "warn");
        segment(sb, broken, total, "bad");
        return sb.append("</div>\n").toString();
    }

    private static void segment(StringBuilder sb, int n, int total, String color) {
        if (n <= 0) return;
        sb.append(String.format(Locale.ROOT, "<i style='width:%.1f%%;background:var(--%s)' title='%d'></i>",
                n * 100.0 / total, color, n));
    }

    static String footer() {
        return """
        <p class="muted" style="margin-top:18px;font-size:11px">Generated by linkchex · <a href="#top">top</a></p>
        </div>
        """;
    }

    static String esc(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
